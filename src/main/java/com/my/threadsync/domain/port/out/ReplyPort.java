package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.CommandReply;

public interface ReplyPort {
    void send(CommandReply reply);
}
