package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.ThreadExportRequest;
import com.my.threadsync.domain.model.ThreadExportResult;
import com.my.threadsync.domain.model.TranscriptExport;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * 트랜스크립트(매번 덮어씀)와 요약 scaffold(최초 1회만 생성)를 로컬에 기록한다.
 */
public interface TranscriptPort {

    TranscriptExport exportThread(ThreadExportRequest request);

    Uni<List<ThreadExportResult>> exportMany(List<ThreadExportRequest> requests);
}
