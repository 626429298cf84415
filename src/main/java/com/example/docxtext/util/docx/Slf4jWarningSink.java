package com.example.docxtext.util.docx;

import lombok.extern.slf4j.Slf4j;

/**
 * 只写日志的告警出口
 */
@Slf4j
public class Slf4jWarningSink implements WarningSink {

    public static final Slf4jWarningSink INSTANCE = new Slf4jWarningSink();

    @Override
    public void warn(String message) {
        log.warn(message);
    }
}
