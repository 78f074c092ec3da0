package hle.remote.client.http;

import hle.remote.client.AbstractRemoteStream;
import hle.remote.client.RemoteClientException;

import java.util.Iterator;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Response stream over a server-sent-event body. Every {@code data:} line is one unit;
 * blank lines, comments and other event fields are skipped.
 *
 * <p>The body is closed once the stream ends, fails or is closed.
 */
class HttpEventStream<O> extends AbstractRemoteStream<O> {

    private static final String DATA_FIELD = "data:";

    private final Stream<String> body;
    private final Iterator<String> lines;
    private final Function<String, O> decoder;
    private final BiFunction<RuntimeException, Long, RemoteClientException> translator;
    private O current;

    /**
     * @param decoder maps the payload of one {@code data:} line to a unit; must not return null
     */
    HttpEventStream(String operation, Stream<String> body, Function<String, O> decoder,
                    BiFunction<RuntimeException, Long, RemoteClientException> translator,
                    Runnable onRelease) {
        super(operation, onRelease);
        this.body = body;
        this.lines = body.iterator();
        this.decoder = decoder;
        this.translator = translator;
    }

    @Override
    protected boolean advance() {
        while (lines.hasNext()) {
            String line = lines.next();
            if (!line.startsWith(DATA_FIELD)) {
                continue;
            }
            String data = line.substring(DATA_FIELD.length()).trim();
            if (!data.isEmpty()) {
                current = decoder.apply(data);
                return true;
            }
        }
        body.close();
        return false;
    }

    @Override
    protected O current() {
        return current;
    }

    @Override
    protected RemoteClientException translateFailure(RuntimeException failure, long deliveredCount) {
        return translator.apply(failure, deliveredCount);
    }

    @Override
    protected void cancel() {
        // Closing the line stream cancels the body subscription and drops the connection
        body.close();
    }
}
