package com.star.logexplorer.parser;

import com.star.logexplorer.entity.LogEntry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two-state machine that folds a file's lines into complete entries.
 *
 * <ul>
 *   <li>{@link State#IDLE}: no entry in progress; non-header lines are dropped</li>
 *   <li>{@link State#ACCUMULATING}: continuation lines are appended to the current entry</li>
 * </ul>
 *
 * <p>A header line always flushes the entry in progress before starting the
 * next one; {@link #finish()} flushes whatever is left at end of input.
 * One instance handles one file.
 *
 * @author Eshmamatov Obidjon
 */
@Slf4j
public class EntryAssembler {

    private static final String FRAME_MARKER = " at ";

    public enum State {
        IDLE,
        ACCUMULATING
    }

    private enum TraceCapture {
        NOT_STARTED,
        CAPTURING,
        CLOSED
    }

    private final LogFormat format;
    private final LogLineParser lineParser;
    private final List<LogEntry> completed = new ArrayList<>();

    @Getter
    private State state = State.IDLE;

    private LogEntry current;
    private StringBuilder messageBuffer;
    private StringBuilder stackTraceBuffer;
    private TraceCapture traceCapture = TraceCapture.NOT_STARTED;

    @Getter
    private long totalLines = 0;

    @Getter
    private long headerLines = 0;

    @Getter
    private long continuationLines = 0;

    @Getter
    private long droppedLines = 0;

    @Getter
    private long defaultedHeaders = 0;

    public EntryAssembler(LogFormat format, LogLineParser lineParser) {
        this.format = format;
        this.lineParser = lineParser;
    }

    public void accept(String line) {
        totalLines++;

        if (format.isEntryStart(line)) {
            flush();
            startEntry(line);
            return;
        }

        if (state == State.IDLE) {
            droppedLines++;
            return;
        }

        appendContinuation(line);
    }

    /**
     * Flushes the entry in progress and returns every completed entry in
     * input order.
     */
    public List<LogEntry> finish() {
        flush();
        log.debug("Assembled {} entries from {} lines ({} continuation, {} dropped, {} defaulted headers)",
                completed.size(), totalLines, continuationLines, droppedLines, defaultedHeaders);
        return Collections.unmodifiableList(completed);
    }

    public List<LogEntry> getCompleted() {
        return Collections.unmodifiableList(completed);
    }

    private void startEntry(String line) {
        ParseResult result = lineParser.parse(line, format);
        if (result.isDefaulted()) {
            defaultedHeaders++;
            log.debug("Header defaulted ({}): {}", result.getReason(), result.getRawLine());
        }

        current = result.getEntry();
        messageBuffer = new StringBuilder(current.getMessage());
        stackTraceBuffer = new StringBuilder();
        traceCapture = TraceCapture.NOT_STARTED;
        state = State.ACCUMULATING;
        headerLines++;
    }

    private void appendContinuation(String line) {
        continuationLines++;
        messageBuffer.append('\n').append(line);

        boolean frame = line.contains(FRAME_MARKER);
        switch (traceCapture) {
            case NOT_STARTED -> {
                if (frame) {
                    stackTraceBuffer.append(line).append('\n');
                    traceCapture = TraceCapture.CAPTURING;
                }
            }
            case CAPTURING -> {
                if (frame) {
                    stackTraceBuffer.append(line).append('\n');
                } else {
                    traceCapture = TraceCapture.CLOSED;
                }
            }
            case CLOSED -> {
                // only the first run of frames is kept
            }
        }
    }

    private void flush() {
        if (state != State.ACCUMULATING) {
            return;
        }

        current.setMessage(messageBuffer.toString());
        if (stackTraceBuffer.length() > 0) {
            current.setStackTrace(stackTraceBuffer.toString());
        }
        completed.add(current);

        current = null;
        messageBuffer = null;
        stackTraceBuffer = null;
        traceCapture = TraceCapture.NOT_STARTED;
        state = State.IDLE;
    }
}
