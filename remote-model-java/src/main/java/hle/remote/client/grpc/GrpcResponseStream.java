package hle.remote.client.grpc;

import hle.remote.client.AbstractRemoteStream;
import hle.remote.client.RemoteClientException;
import io.grpc.ClientCall;

import java.util.Iterator;
import java.util.function.BiFunction;

/**
 * Response stream of a server-streaming call. Each received message is one unit.
 */
class GrpcResponseStream<O> extends AbstractRemoteStream<O> {

    private final ClientCall<?, O> call;
    private final Iterator<O> responses;
    private final BiFunction<RuntimeException, Long, RemoteClientException> translator;
    private O current;

    GrpcResponseStream(String operation, ClientCall<?, O> call, Iterator<O> responses,
                       BiFunction<RuntimeException, Long, RemoteClientException> translator,
                       Runnable onRelease) {
        super(operation, onRelease);
        this.call = call;
        this.responses = responses;
        this.translator = translator;
    }

    @Override
    protected boolean advance() {
        if (!responses.hasNext()) {
            return false;
        }
        current = responses.next();
        return true;
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
        call.cancel("Response stream abandoned by caller", null);
    }
}
