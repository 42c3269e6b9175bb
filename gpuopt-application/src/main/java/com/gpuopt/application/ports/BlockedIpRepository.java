package com.gpuopt.application.ports;

import com.gpuopt.domain.model.BlockedIp;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface BlockedIpRepository {

    /** Insert or reactivate. */
    void save(BlockedIp entry);

    Optional<BlockedIp> find(String ip);

    /** @return true when an active row was deactivated */
    boolean deactivate(String ip);

    List<BlockedIp> findActive(Instant now);
}
