package com.my.threadsync.domain.port.in;

import com.my.threadsync.domain.model.ConnectionReport;

public interface CheckConnectionsUseCase {
    ConnectionReport checkConnections();
}
