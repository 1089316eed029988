package com.my.threadsync.domain.port.in;

import com.my.threadsync.domain.model.SyncStatus;
import com.my.threadsync.domain.model.ThreadPrompt;

public interface ManageMappingsUseCase {

    SyncStatus status();

    ThreadPrompt promptFor(String fingerprint);

    boolean setPrompt(String fingerprint, String prompt);

    boolean unmap(String fingerprint);
}
