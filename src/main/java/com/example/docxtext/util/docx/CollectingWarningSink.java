package com.example.docxtext.util.docx;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 收集告警，供接口返回给调用方；同时写日志
 */
@Slf4j
public class CollectingWarningSink implements WarningSink {

    private final List<String> messages = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void warn(String message) {
        log.warn(message);
        messages.add(message);
    }

    public List<String> getMessages() {
        synchronized (messages) {
            return new ArrayList<>(messages);
        }
    }
}
