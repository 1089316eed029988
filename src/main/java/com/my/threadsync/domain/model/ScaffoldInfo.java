package com.my.threadsync.domain.model;

import java.nio.file.Path;

/**
 * {@code created} 가 false 면 기존 파일이 있어 손대지 않았다는 뜻이다.
 */
public record ScaffoldInfo(Path path, String filename, boolean created) {
}
