package com.pageanalyzer.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * JUL 루트 핸들러 세팅. {@link StructuredLog} 의 JSON 라인을 메시지 그대로 한 줄씩 출력한다.
 * 임베딩하는 쪽(CLI/서비스)이 시작 시 1회 호출. 라이브러리 자체는 호출하지 않는다.
 */
public final class LoggingConfigurator {
    private LoggingConfigurator() {}

    /** 메시지만 한 줄로 (StructuredLog 가 이미 JSON 을 만든다) */
    static final class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord r) {
            String msg = formatMessage(r);
            if (r.getThrown() != null && !msg.startsWith("{")) {
                msg = msg + " | " + r.getThrown();
            }
            return msg + System.lineSeparator();
        }
    }

    /** 콘솔만 */
    public static void init(Level rootLevel) {
        init(null, rootLevel, 0, 0);
    }

    /**
     * @param logDir    null 이면 파일 핸들러 없이 콘솔만
     * @param maxBytes  파일 1개 최대 크기 (회전)
     * @param fileCount 회전 파일 수
     */
    public static void init(Path logDir, Level rootLevel, int maxBytes, int fileCount) {
        Logger root = LogManager.getLogManager().getLogger("");
        for (Handler h : root.getHandlers()) {
            root.removeHandler(h);
            h.close();
        }

        Formatter fmt = new LineFormatter();
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(rootLevel);
        console.setFormatter(fmt);
        root.addHandler(console);

        if (logDir != null) {
            try {
                Files.createDirectories(logDir);
                String pattern = logDir.resolve("page-analyzer-%g.log").toString();
                FileHandler file = new FileHandler(pattern, Math.max(0, maxBytes), Math.max(1, fileCount), true);
                file.setLevel(rootLevel);
                file.setFormatter(fmt);
                root.addHandler(file);
            } catch (IOException e) {
                root.log(Level.WARNING, "file log handler disabled: " + e.getMessage(), e);
            }
        }
        root.setLevel(rootLevel);
    }
}
