package com.gpuopt.application.ports;

import com.gpuopt.domain.model.UsageRecord;

import java.util.List;

public interface UsageRepository {

    /** Newest first. */
    List<UsageRecord> recent(String customerEmail, int limit);
}
