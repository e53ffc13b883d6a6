package ai.tidal.cli;

import ai.tidal.events.Event;
import ai.tidal.events.EventBus;
import ai.tidal.events.EventHandler;
import ai.tidal.events.EventType;
import ai.tidal.events.Payloads;
import java.io.PrintStream;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * Plain-text renderer for coordinated output.
 *
 * <p>Streamed turns are echoed live from {@code stream_coalesced} snapshots; the finalized {@code message} that
 * follows carries the same {@code stream_id} in its metadata and is not printed again. Side messages are printed as
 * {@code [TYPE]}-prefixed lines.
 */
public final class ConsoleDisplay implements EventHandler {
    private static final List<EventType> RENDERED = List.of(
            EventType.STREAM_START,
            EventType.STREAM_COALESCED,
            EventType.STREAM_END,
            EventType.MESSAGE,
            EventType.STATUS,
            EventType.ERROR,
            EventType.TOOL,
            EventType.WARNING,
            EventType.TOKEN_UPDATE);

    private enum Section {
        NONE,
        REASONING,
        CONTENT
    }

    private final PrintStream out;
    private final boolean color;
    private final boolean showTokens;
    private final Object renderLock = new Object();

    // guarded by renderLock
    private @Nullable String liveStreamId;
    private int printedContent = 0;
    private int printedReasoning = 0;
    private Section section = Section.NONE;
    private final Set<String> echoedStreams = new HashSet<>();

    public ConsoleDisplay(PrintStream out) {
        this(out, false, false);
    }

    public ConsoleDisplay(PrintStream out, boolean color, boolean showTokens) {
        this.out = Objects.requireNonNull(out, "out");
        this.color = color;
        this.showTokens = showTokens;
    }

    public void attach(EventBus bus) {
        RENDERED.forEach(type -> bus.subscribe(type, this));
    }

    public void detach(EventBus bus) {
        RENDERED.forEach(type -> bus.unsubscribe(type, this));
    }

    @Override
    public CompletableFuture<Void> handle(Event event) {
        synchronized (renderLock) {
            switch (event.type()) {
                case STREAM_START -> startStream(event);
                case STREAM_COALESCED -> echoSnapshot(event);
                case STREAM_END -> endStream(event);
                case MESSAGE -> renderMessage(event);
                case STATUS -> line("[STATUS] " + event.getString(Payloads.STATUS_TYPE, "")
                        + formatData(event.getMap(Payloads.DATA).toString()));
                case ERROR -> renderError(event);
                case TOOL -> line("[TOOL] " + event.getString(Payloads.CONTENT, ""));
                case WARNING -> line(Ansi.yellow("[WARNING] " + event.getString(Payloads.CONTENT, ""), color));
                case TOKEN_UPDATE -> {
                    if (showTokens) {
                        line(Ansi.dim("[TOKENS] " + event.payload(), color));
                    }
                }
                default -> {
                    // raw chunks are consumed by the coordinator
                }
            }
            out.flush();
        }
        return CompletableFuture.completedFuture(null);
    }

    private void startStream(Event event) {
        closeLiveStream();
        // reached after a finalized message or when the previous stream was superseded
        echoedStreams.clear();
        liveStreamId = event.getString(Payloads.STREAM_ID);
        printedContent = 0;
        printedReasoning = 0;
        section = Section.NONE;
    }

    private void echoSnapshot(Event event) {
        var streamId = event.getString(Payloads.STREAM_ID);
        if (streamId == null || !streamId.equals(liveStreamId)) {
            return;
        }
        var role = event.getString(Payloads.ROLE, Payloads.ROLE_ASSISTANT);
        var reasoning = event.getString(Payloads.REASONING_SO_FAR, "");
        if (reasoning.length() > printedReasoning) {
            switchSection(Section.REASONING, role);
            out.print(Ansi.dim(reasoning.substring(printedReasoning), color));
            printedReasoning = reasoning.length();
        }
        var content = event.getString(Payloads.CONTENT_SO_FAR, "");
        if (content.length() > printedContent) {
            switchSection(Section.CONTENT, role);
            out.print(content.substring(printedContent));
            printedContent = content.length();
        }
        echoedStreams.add(streamId);
    }

    private void switchSection(Section next, String role) {
        if (section == next) {
            return;
        }
        if (section != Section.NONE) {
            out.println();
        }
        out.print(next == Section.REASONING ? Ansi.dim("[REASONING] ", color) : label(role) + " ");
        section = next;
    }

    private void endStream(Event event) {
        var streamId = event.getString(Payloads.STREAM_ID);
        if (streamId == null || !streamId.equals(liveStreamId)) {
            return;
        }
        closeLiveStream();
        if (event.getBoolean(Payloads.ABORTED)) {
            line(Ansi.yellow("[ABORTED] stream " + streamId, color));
        }
    }

    private void closeLiveStream() {
        breakLine();
        liveStreamId = null;
    }

    private void breakLine() {
        if (section != Section.NONE) {
            out.println();
        }
        section = Section.NONE;
    }

    private void renderMessage(Event event) {
        var streamId = event.getMap(Payloads.METADATA).get(Payloads.STREAM_ID);
        if (streamId instanceof String id && echoedStreams.remove(id)) {
            return;
        }
        var role = event.getString(Payloads.ROLE, "unknown");
        var content = event.getString(Payloads.CONTENT, "");
        if (streamId != null && content.isEmpty()) {
            return;
        }
        line(label(role) + " " + content);
    }

    private void renderError(Event event) {
        var details = event.getString(Payloads.DETAILS);
        var text = "[ERROR] " + event.getString(Payloads.MESSAGE, "")
                + (details == null || details.isBlank() ? "" : " (" + details + ")");
        line(Ansi.red(text, color));
    }

    private void line(String text) {
        breakLine();
        out.println(text);
    }

    private static String label(String role) {
        return "[" + role.toUpperCase(Locale.ROOT) + "]";
    }

    private static String formatData(String data) {
        return "{}".equals(data) ? "" : " " + data;
    }
}
