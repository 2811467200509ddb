package com.encarbot.db;

import com.encarbot.model.ClosureReason;
import com.encarbot.model.Listing;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable owner of listing state. Every write is a single-row operation keyed by listing
 * id. Implementations must keep {@code firstSeenAt} unchanged once written and must never
 * clear {@code closed}.
 */
public interface ListingStore {

    Optional<Listing> find(String id) throws PersistenceException;

    void upsert(Listing listing) throws PersistenceException;

    boolean isEmpty() throws PersistenceException;

    int count() throws PersistenceException;

    /**
     * Active listings first seen at or before {@code firstSeenBefore}, least recently
     * updated first.
     */
    List<Listing> findActiveForClosureScan(Instant firstSeenBefore, int limit) throws PersistenceException;

    /**
     * Moves a listing to closed. Returns false when it already was closed.
     *
     * @throws PersistenceException with {@link PersistenceException.Kind#NOT_FOUND} for an unknown id
     */
    boolean markClosed(String id, ClosureReason reason, Instant detectedAt) throws PersistenceException;

    /**
     * Returns coupe, not-closed listings flagged truly-new and first seen since the given
     * instant, clearing their flag in the same call.
     */
    List<Listing> claimTrulyNew(Instant firstSeenSince) throws PersistenceException;

    List<Listing> findFirstSeenSince(Instant since) throws PersistenceException;

    int deleteNotUpdatedSince(Instant horizon) throws PersistenceException;

    StoreStatistics statistics(Instant now) throws PersistenceException;
}
