package com.questrail.meshlink.transport;

import com.questrail.meshlink.api.PeerDevice;
import com.questrail.meshlink.error.OperationFailedException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * FakeTransportLink
 * -----------------------------------------------------------------------------
 * Test-only {@link TransportLink}.
 *
 * <p>Every asynchronous call is recorded as a {@link Call}. In manual mode
 * (the default) the test completes calls itself. In auto mode calls complete
 * at once: writes succeed, reads return the next queued FromRadio frame (or an
 * empty array), discovery returns {@link #services()}. Individual calls can
 * still be held or failed with {@link #holdNext(CallKind)} and
 * {@link #failNext(CallKind, Throwable)}.</p>
 *
 * <p>Like a real transport, {@link #disconnect()} does not report a link-down.
 * It contains no frame semantics apart from the optional ToRadio hook.</p>
 */
public final class FakeTransportLink implements TransportLink {

    public enum CallKind {
        WRITE,
        READ,
        SET_NOTIFY,
        RELIABLE_WRITE,
        DISCOVER_SERVICES,
        REQUEST_TRANSFER_UNIT,
        INVALIDATE_CACHE,
        RESTART_ADAPTER
    }

    /**
     * One recorded asynchronous call.
     */
    public static final class Call {
        private final CallKind kind;
        private final CharacteristicId target;
        private final byte[] payload;
        private final CompletableFuture<Object> future = new CompletableFuture<>();

        private Call(CallKind kind, CharacteristicId target, byte[] payload) {
            this.kind = kind;
            this.target = target;
            this.payload = payload;
        }

        public CallKind kind() {
            return kind;
        }

        public CharacteristicId target() {
            return target;
        }

        public byte[] payload() {
            return payload;
        }

        public boolean isDone() {
            return future.isDone();
        }

        public void complete(Object value) {
            future.complete(value);
        }

        public void fail(Throwable cause) {
            future.completeExceptionally(cause);
        }

        @Override
        public String toString() {
            return kind + " " + target;
        }
    }

    private TransportLinkListener listener;

    private final List<Call> calls = new ArrayList<>();
    private final List<PeerDevice> connects = new ArrayList<>();
    private final List<PeerDevice> authorizationRequests = new ArrayList<>();
    private final Deque<byte[]> fromRadio = new ArrayDeque<>();
    private final Map<CallKind, Deque<Throwable>> injectedFailures = new EnumMap<>(CallKind.class);
    private final Set<CallKind> held = EnumSet.noneOf(CallKind.class);

    private Set<CharacteristicId> services = MeshServiceProfile.REQUIRED;
    private final Set<CharacteristicId> unavailable = new HashSet<>();
    private Consumer<byte[]> toRadioHook = frame -> { };

    private boolean autoRespond;
    private boolean autoLinkUp;
    private Boolean autoAuthorize;
    private boolean linkUp;
    private int disconnects;

    // ---------------------------------------------------------------------
    // Configuration
    // ---------------------------------------------------------------------

    /** Complete calls immediately instead of waiting for the test. */
    public FakeTransportLink autoRespond() {
        this.autoRespond = true;
        return this;
    }

    /** Report link-up from inside {@link #connect(PeerDevice)}. */
    public FakeTransportLink autoLinkUp() {
        this.autoLinkUp = true;
        return this;
    }

    /** Answer authorization requests from inside {@link #requestAuthorization(PeerDevice)}. */
    public FakeTransportLink autoAuthorize(boolean granted) {
        this.autoAuthorize = granted;
        return this;
    }

    public FakeTransportLink withServices(Set<CharacteristicId> services) {
        this.services = Set.copyOf(services);
        return this;
    }

    /** Called with every payload written to ToRadio, before the write completes. */
    public FakeTransportLink onToRadio(Consumer<byte[]> hook) {
        this.toRadioHook = Objects.requireNonNull(hook, "hook");
        return this;
    }

    /** In auto mode, leave the next call of {@code kind} pending. */
    public void holdNext(CallKind kind) {
        held.add(kind);
    }

    /** In auto mode, fail the next call of {@code kind} with {@code cause}. */
    public void failNext(CallKind kind, Throwable cause) {
        injectedFailures.computeIfAbsent(kind, k -> new ArrayDeque<>()).addLast(cause);
    }

    public void makeUnavailable(CharacteristicId characteristic) {
        unavailable.add(characteristic);
    }

    // ---------------------------------------------------------------------
    // Simulated peer
    // ---------------------------------------------------------------------

    public void queueFromRadio(byte[]... frames) {
        for (byte[] frame : frames) {
            fromRadio.addLast(frame.clone());
        }
    }

    public int queuedFromRadio() {
        return fromRadio.size();
    }

    /** Marks the link up without reporting it, for tests that have no listener. */
    public void setLinkUp(boolean up) {
        this.linkUp = up;
    }

    public void bringLinkUp() {
        linkUp = true;
        requireListener().onLinkUp();
    }

    public void dropLink(int reasonCode) {
        linkUp = false;
        requireListener().onLinkDown(reasonCode);
    }

    public void answerAuthorization(boolean granted) {
        requireListener().onAuthorizationResult(granted);
    }

    public void sendNotification(CharacteristicId source, byte[] value) {
        requireListener().onNotification(source, value);
    }

    // ---------------------------------------------------------------------
    // TransportLink
    // ---------------------------------------------------------------------

    @Override
    public void setListener(TransportLinkListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void connect(PeerDevice device) {
        connects.add(device);
        if (autoLinkUp) {
            bringLinkUp();
        }
    }

    @Override
    public void disconnect() {
        linkUp = false;
        disconnects++;
    }

    @Override
    public void requestAuthorization(PeerDevice device) {
        authorizationRequests.add(device);
        if (autoAuthorize != null) {
            answerAuthorization(autoAuthorize);
        }
    }

    @Override
    public boolean isAvailable(CharacteristicId characteristic) {
        return linkUp && services.contains(characteristic) && !unavailable.contains(characteristic);
    }

    @Override
    public CompletionStage<Set<CharacteristicId>> discoverServices() {
        return record(CallKind.DISCOVER_SERVICES, null, null, services)
                .thenApply(FakeTransportLink::characteristics);
    }

    @Override
    public CompletionStage<Integer> requestTransferUnit(int requestedSize) {
        return record(CallKind.REQUEST_TRANSFER_UNIT, null, null, requestedSize)
                .thenApply(Integer.class::cast);
    }

    @Override
    public CompletionStage<Void> performWrite(CharacteristicId destination, byte[] payload) {
        return record(CallKind.WRITE, destination, payload.clone(), null).thenApply(FakeTransportLink::none);
    }

    @Override
    public CompletionStage<byte[]> performRead(CharacteristicId source) {
        return record(CallKind.READ, source, null, null).thenApply(byte[].class::cast);
    }

    @Override
    public CompletionStage<Void> setNotify(CharacteristicId source, boolean enabled) {
        return record(CallKind.SET_NOTIFY, source, null, null).thenApply(FakeTransportLink::none);
    }

    @Override
    public CompletionStage<Void> performReliableWrite(CharacteristicId destination, byte[] payload) {
        return record(CallKind.RELIABLE_WRITE, destination, payload.clone(), null)
                .thenApply(FakeTransportLink::none);
    }

    @Override
    public CompletionStage<Void> invalidateCache() {
        return record(CallKind.INVALIDATE_CACHE, null, null, null).thenApply(FakeTransportLink::none);
    }

    @Override
    public CompletionStage<Void> restartAdapter() {
        return record(CallKind.RESTART_ADAPTER, null, null, null).thenApply(FakeTransportLink::none);
    }

    private CompletionStage<Object> record(CallKind kind, CharacteristicId target, byte[] payload, Object autoValue) {
        Call call = new Call(kind, target, payload);
        calls.add(call);

        if (payload != null && MeshServiceProfile.TO_RADIO.equals(target)) {
            toRadioHook.accept(payload.clone());
        }

        if (autoRespond && !held.remove(kind)) {
            Deque<Throwable> failures = injectedFailures.get(kind);
            if (failures != null && !failures.isEmpty()) {
                call.fail(failures.pollFirst());
            } else if (kind == CallKind.READ) {
                byte[] next = fromRadio.pollFirst();
                call.complete(next == null ? new byte[0] : next);
            } else {
                call.complete(autoValue);
            }
        }
        return call.future;
    }

    private static Void none(Object ignored) {
        return null;
    }

    private static Set<CharacteristicId> characteristics(Object value) {
        if (value == null) {
            return null;
        }
        return ((Set<?>) value).stream()
                .map(CharacteristicId.class::cast)
                .collect(Collectors.toUnmodifiableSet());
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public List<Call> calls() {
        return Collections.unmodifiableList(calls);
    }

    public List<Call> calls(CallKind kind) {
        return calls.stream().filter(c -> c.kind() == kind).collect(Collectors.toList());
    }

    public Call lastCall() {
        if (calls.isEmpty()) {
            throw new IllegalStateException("no calls recorded");
        }
        return calls.get(calls.size() - 1);
    }

    public List<Call> pendingCalls() {
        return calls.stream().filter(c -> !c.isDone()).collect(Collectors.toList());
    }

    /** Payloads handed to ToRadio, by either write flavor, in order. */
    public List<byte[]> toRadioWrites() {
        return calls.stream()
                .filter(c -> c.kind() == CallKind.WRITE || c.kind() == CallKind.RELIABLE_WRITE)
                .filter(c -> MeshServiceProfile.TO_RADIO.equals(c.target()))
                .map(Call::payload)
                .collect(Collectors.toList());
    }

    public List<PeerDevice> connects() {
        return Collections.unmodifiableList(connects);
    }

    public List<PeerDevice> authorizationRequests() {
        return Collections.unmodifiableList(authorizationRequests);
    }

    public int disconnects() {
        return disconnects;
    }

    public boolean isLinkUp() {
        return linkUp;
    }

    public Set<CharacteristicId> services() {
        return services;
    }

    public void clearCalls() {
        calls.clear();
    }

    /** Convenience failure for transport calls. */
    public static OperationFailedException gattError(int code) {
        return new OperationFailedException("GATT error " + code, code);
    }

    private TransportLinkListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
