package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.PublishAccess;
import com.my.threadsync.domain.model.PublishedDocument;

/**
 * 문서를 게시하는 콘텐츠 관리 대상. 실패는 {@link com.my.threadsync.domain.exception.PublishException}.
 */
public interface PublishPort {
    PublishedDocument create(DocumentDraft draft);
    PublishedDocument update(long documentId, DocumentDraft draft);
    PublishAccess checkAccess();
}
