package org.csu.samplelang.cli.tool;

import java.io.PrintStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * 控制台日志配置：单行格式，输出到给定的流（一般是 stderr）。
 */
public final class ConsoleLogging {

    private static final String FORMAT = "[%1$tH:%1$tM:%1$tS.%1$tL %4$s %3$s] %5$s%6$s%n";

    private ConsoleLogging() {
    }

    public static void install(PrintStream stream, boolean verbose) {
        System.setProperty("java.util.logging.SimpleFormatter.format", FORMAT);
        Logger rootLogger = Logger.getLogger("");
        Handler handler = new StreamHandler(stream, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        Level level = verbose ? Level.FINE : Level.WARNING;
        handler.setLevel(level);
        for (Handler existing : rootLogger.getHandlers()) {
            rootLogger.removeHandler(existing);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(level);
    }
}
