package com.encarbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringLogRow {
    private Long id;
    private String loggedAt;
    private String action;
    private String details;
    private int newListingsFound;
    private int totalListingsScanned;
}
