package hle.remote.testing;

import hle.remote.signature.TargetSignature;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Behavior shared by the sample gRPC and HTTP servers, keyed by the input name.
 */
public final class SampleTasks {

    public static final String TARGET_ID = "sample-model";
    public static final String SERVICE_NAME = "sample.SampleTaskService";

    public static final String RUN = "run";
    public static final String RUN_STREAM_IN = "run_stream_in";
    public static final String RUN_STREAM_OUT = "run_stream_out";

    public static final int STREAM_OUT_UNITS = 10;

    /** Unary input rejected by the server with an application error. */
    public static final String FAIL = "fail";
    /** Unary input answered after {@link #SLOW_MILLIS}. */
    public static final String SLOW = "slow";
    /** Stream-out input failing after three units. */
    public static final String FAIL_AFTER_3 = "fail-after-3";
    /** Stream-out input emitting until the caller cancels. */
    public static final String ENDLESS = "endless";
    /** Stream-out input whose second of three units is JSON {@code null}. */
    public static final String NULL_UNIT = "null-unit";

    public static final long SLOW_MILLIS = 2000;
    public static final String ERROR_MESSAGE = "bad input";

    private SampleTasks() {
    }

    public static TargetSignature signature() {
        return TargetSignature.builder(TARGET_ID)
            .serviceName(SERVICE_NAME)
            .unary(RUN, SampleInput.class, SampleOutput.class)
            .streamIn(RUN_STREAM_IN, SampleInput.class, SampleOutput.class)
            .streamOut(RUN_STREAM_OUT, SampleInput.class, SampleOutput.class)
            .build();
    }

    public static SampleOutput greet(SampleInput input) {
        return new SampleOutput("Hello " + input.getName());
    }

    public static SampleOutput greetAll(List<SampleInput> inputs) {
        return new SampleOutput("Hello " + inputs.stream().map(SampleInput::getName).collect(Collectors.joining(",")));
    }

    public static SampleOutput streamUnit(SampleInput input) {
        return new SampleOutput("Hello " + input.getName() + " stream");
    }

    static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
