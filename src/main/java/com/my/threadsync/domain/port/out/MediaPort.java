package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.DownloadedMedia;
import com.my.threadsync.domain.model.MediaAsset;
import com.my.threadsync.domain.model.MessageMedia;
import com.my.threadsync.domain.model.Outcome;
import com.my.threadsync.domain.model.ThreadMessage;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * 첨부 이미지 다운로드. 에셋 단위 실패는 {@link Outcome.Failed} 로 돌려주고 예외를 던지지 않는다.
 */
public interface MediaPort {

    List<MediaAsset> extractAssets(ThreadMessage message);

    Outcome<DownloadedMedia> download(MediaAsset asset, String fingerprint, String messageTs, int index);

    Uni<List<Outcome<DownloadedMedia>>> downloadAllForMessage(ThreadMessage message, String fingerprint);

    Uni<List<MessageMedia>> downloadAllForThread(List<ThreadMessage> messages, String fingerprint);
}
