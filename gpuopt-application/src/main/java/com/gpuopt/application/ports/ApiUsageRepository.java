package com.gpuopt.application.ports;

import com.gpuopt.domain.model.ApiUsageLog;

public interface ApiUsageRepository {
    void append(ApiUsageLog entry);
}
