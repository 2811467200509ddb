package com.encarbot.notify;

import com.encarbot.core.MonitoringCycle;
import com.encarbot.model.Listing;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositeNotifierTest {

    @Test
    void failingChannelShouldNotBlockOthers() {
        RecordingNotifier recording = new RecordingNotifier();
        CompositeNotifier composite = new CompositeNotifier(List.of(new ExplodingNotifier(), recording));

        assertTrue(composite.sendStatus("STARTED", "ok"));
        assertEquals(1, recording.statuses.size());
    }

    private static final class ExplodingNotifier implements Notifier {
        @Override
        public boolean sendListingAlert(Listing listing) {
            throw new IllegalStateException("down");
        }

        @Override
        public boolean sendBatchAlert(List<Listing> listings, String summary) {
            throw new IllegalStateException("down");
        }

        @Override
        public boolean sendCycleReport(MonitoringCycle cycle) {
            throw new IllegalStateException("down");
        }

        @Override
        public boolean sendStatus(String status, String details) {
            throw new IllegalStateException("down");
        }

        @Override
        public boolean sendError(String context, Throwable error) {
            throw new IllegalStateException("down");
        }
    }
}
