package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.ThreadMapping;

import java.util.List;
import java.util.Optional;

/**
 * fingerprint 별 원격 문서 매핑의 영속 저장소. 변경할 때마다 전체 테이블을 다시 쓴다.
 */
public interface ThreadMappingStore {

    /**
     * 저장된 매핑을 읽는다. 파일이 없으면 빈 상태, 형식이 깨졌으면 예외.
     */
    void load();

    Optional<Long> getDocumentId(String fingerprint);

    boolean isMapped(String fingerprint);

    ThreadMapping upsert(String fingerprint, long documentId, String title, String derivedPrompt);

    Optional<String> getPrompt(String fingerprint);

    /**
     * @return 매핑이 없어 저장하지 않았으면 false
     */
    boolean setPrompt(String fingerprint, String prompt);

    boolean remove(String fingerprint);

    List<ThreadMapping> all();
}
