package com.my.threadsync.domain.port.in;

import com.my.threadsync.domain.model.PipelineProgress;
import com.my.threadsync.domain.model.PipelineRun;
import com.my.threadsync.domain.model.SyncReport;
import com.my.threadsync.domain.model.ThreadSyncResult;

import java.util.Optional;

public interface SyncThreadsUseCase {

    /**
     * 새 실행 컨텍스트를 등록한다. 같은 채널에 살아 있는 실행이 있으면 거부된다.
     */
    PipelineRun begin();

    SyncReport syncAll(PipelineRun run);

    default SyncReport syncAll() {
        return syncAll(begin());
    }

    ThreadSyncResult syncThread(String fingerprint);

    Optional<PipelineProgress> progress(String runId);

    /**
     * 설정된 채널에서 아직 끝나지 않은 실행의 스냅샷.
     */
    Optional<PipelineProgress> liveProgress();
}
