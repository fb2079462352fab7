package stargate.supervisor;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import stargate.common.ClientConfig;
import stargate.common.ClientRole;
import stargate.common.DuplicateRegistrationException;
import stargate.common.MissingSubscriptionException;
import stargate.common.RoleArgs;
import stargate.config.ClientConfigReader;
import stargate.process.ExitReason;
import stargate.process.SupervisedProcess;
import stargate.registry.ProcessName;
import stargate.supervisor.test.Await;
import stargate.supervisor.test.FakeGatewayTransport;
import stargate.websocket.client.ConnectionProcess;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class StargateSupervisorTests {
    private static final ProcessName PRODUCER_0 = ProcessName.of(ClientRole.PRODUCER, 0);
    private static final ProcessName PRODUCER_1 = ProcessName.of(ClientRole.PRODUCER, 1);
    private static final ProcessName CONSUMER = ProcessName.of(ClientRole.CONSUMER);
    private static final ProcessName READER = ProcessName.of(ClientRole.READER);
    private static final List<ProcessName> CONNECTIONS = List.of(PRODUCER_0, PRODUCER_1, CONSUMER, READER);

    private FakeGatewayTransport transport;
    private StargateSupervisor supervisor;

    @Before
    public void setUp() {
        transport = new FakeGatewayTransport();
    }

    @After
    public void tearDown() {
        if (supervisor != null) {
            supervisor.stop();
        }
    }

    private static RoleArgs.Builder topic(String topic) {
        return RoleArgs.builder().tenant("public").namespace("default").topic(topic);
    }

    private static ClientConfig config() {
        return ClientConfig.builder()
                .name("test")
                .host("localhost:8080")
                .producers(List.of(topic("a").build(), topic("b").build()))
                .consumer(topic("c").subscription("s").build())
                .reader(topic("d").build())
                .build();
    }

    private SupervisedProcess child(ProcessName name) {
        return supervisor.getChild(name).orElseThrow();
    }

    private void awaitAllRegistered() throws InterruptedException {
        Await.until("all connections are registered and alive", () -> CONNECTIONS.stream().allMatch(name ->
                supervisor.getChild(name).map(SupervisedProcess::isAlive).orElse(false)
                        && supervisor.whereis(name).filter(p -> p == child(name)).isPresent()));
    }

    @Test
    public void startsChildrenInOrder() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);

        assertEquals(SupervisorState.RUNNING, supervisor.getState());
        assertEquals("sg_sup_test", supervisor.getName());
        assertEquals("sg_reg_test", supervisor.getRegistry().getName());
        assertTrue(child(ChildSpec.REGISTRY_NAME).isAlive());
        List<String> urls = List.of(
                "ws://localhost:8080/ws/v2/producer/persistent/public/default/a",
                "ws://localhost:8080/ws/v2/producer/persistent/public/default/b",
                "ws://localhost:8080/ws/v2/consumer/persistent/public/default/c/s",
                "ws://localhost:8080/ws/v2/reader/persistent/public/default/d");
        assertEquals(4, transport.getConnections().size());
        for (int i = 0; i < urls.size(); i++) {
            assertEquals(urls.get(i), transport.getConnections().get(i).getUri().toString());
            assertTrue(supervisor.whereis(CONNECTIONS.get(i)).orElseThrow() instanceof ConnectionProcess);
        }
    }

    @Test
    public void terminatedChildIsRestartedWithAllLaterChildren() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);
        SupervisedProcess producer0 = child(PRODUCER_0);
        SupervisedProcess producer1 = child(PRODUCER_1);
        SupervisedProcess consumer = child(CONSUMER);
        SupervisedProcess reader = child(READER);

        transport.latest("/default/b").orElseThrow().closeRemotely(1011, "unexpected");

        Await.until("reader was restarted", () -> supervisor.getRestartCount(READER) == 1);
        awaitAllRegistered();
        assertSame(producer0, child(PRODUCER_0));
        assertEquals(0, supervisor.getRestartCount(PRODUCER_0));
        assertNotSame(producer1, child(PRODUCER_1));
        assertNotSame(consumer, child(CONSUMER));
        assertNotSame(reader, child(READER));
        assertEquals(1, supervisor.getRestartCount(PRODUCER_1));
        assertEquals(1, supervisor.getRestartCount(CONSUMER));

        assertEquals(ExitReason.Kind.CLOSED, producer1.getExitFuture().get().getKind());
        assertTrue(consumer.getExitFuture().get().isShutdown());
        assertTrue(reader.getExitFuture().get().isShutdown());
        assertEquals(7, transport.getConnections().size());
        assertEquals(4, transport.openConnections());
    }

    @Test
    public void lastChildTerminationRestartsOnlyIt() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);
        SupervisedProcess consumer = child(CONSUMER);
        SupervisedProcess reader = child(READER);

        assertTrue(supervisor.terminateChild(READER));

        Await.until("reader was restarted", () -> supervisor.getRestartCount(READER) == 1);
        awaitAllRegistered();
        assertSame(consumer, child(CONSUMER));
        assertNotSame(reader, child(READER));
        assertEquals(ExitReason.Kind.KILLED, reader.getExitFuture().get().getKind());
        assertEquals(5, transport.getConnections().size());
    }

    @Test
    public void producersOfAProducerOnlyClientRestartIndependently() throws Exception {
        ClientConfig config = ClientConfig.builder().name("producers").host("localhost:8080")
                .producers(List.of(topic("a").build(), topic("b").build()))
                .build();
        supervisor = StargateSupervisor.start(config, transport);
        SupervisedProcess producer0 = child(PRODUCER_0);

        supervisor.terminateChild(PRODUCER_1);
        Await.until("producer-1 was restarted", () -> supervisor.getRestartCount(PRODUCER_1) == 1
                && supervisor.whereis(PRODUCER_1).isPresent());
        assertSame(producer0, child(PRODUCER_0));
        assertEquals(0, supervisor.getRestartCount(PRODUCER_0));

        supervisor.terminateChild(PRODUCER_0);
        Await.until("both producers were restarted", () -> supervisor.getRestartCount(PRODUCER_1) == 2
                && supervisor.whereis(PRODUCER_1).filter(p -> p == child(PRODUCER_1)).isPresent()
                && supervisor.whereis(PRODUCER_0).filter(p -> p == child(PRODUCER_0)).isPresent());
        assertEquals(1, supervisor.getRestartCount(PRODUCER_0));
    }

    @Test
    public void registryTerminationRestartsEverything() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);

        assertTrue(supervisor.terminateChild(ChildSpec.REGISTRY_NAME));

        Await.until("reader was restarted", () -> supervisor.getRestartCount(READER) == 1);
        awaitAllRegistered();
        assertTrue(supervisor.getRegistry().isOpen());
        for (ProcessName name : CONNECTIONS) {
            assertEquals(1, supervisor.getRestartCount(name));
        }
        assertEquals(SupervisorState.RUNNING, supervisor.getState());
    }

    @Test
    public void failedRestartIsRetriedUntilItSucceeds() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);
        AtomicInteger refusals = new AtomicInteger();
        transport.refuseWhen(uri -> uri.getPath().contains("/reader/") && refusals.incrementAndGet() <= 3);

        transport.latest("/reader/").orElseThrow().closeRemotely(1001, "going away");

        Await.until("reader was restarted", () -> supervisor.getRestartCount(READER) == 4);
        awaitAllRegistered();
        assertEquals(0, supervisor.getRestartCount(CONSUMER));
        assertEquals(SupervisorState.RUNNING, supervisor.getState());
    }

    @Test
    public void initialStartFailureStopsStartedChildren() throws Exception {
        transport.refuseWhen(uri -> uri.getPath().contains("/consumer/"));
        supervisor = new StargateSupervisor(new SupervisionPlanner().plan(config()), new DefaultProcessFactory(transport));
        try {
            supervisor.start();
            fail("Expected start to fail");
        } catch (SupervisorStartException e) {
            assertEquals(CONSUMER, e.getChild());
        }
        assertEquals(SupervisorState.FAILED, supervisor.getState());
        assertEquals(2, transport.getConnections().size());
        assertEquals(0, transport.openConnections());
        assertFalse(supervisor.getRegistry().isOpen());
        assertTrue(supervisor.getRegistry().registeredNames().isEmpty());
    }

    @Test
    public void configurationErrorsPreventAnyConnection() {
        ClientConfig config = ClientConfig.builder().host("localhost:8080")
                .producer(topic("a").build())
                .consumer(topic("c").build())
                .build();
        try {
            supervisor = StargateSupervisor.start(config, transport);
            fail("Expected configuration error");
        } catch (MissingSubscriptionException expected) {
            // ok
        } catch (SupervisorStartException e) {
            fail("Configuration errors must be reported before starting: " + e);
        }
        assertTrue(transport.getConnections().isEmpty());
    }

    @Test
    public void duplicateRegistrationIsFatal() throws Exception {
        AtomicInteger readers = new AtomicInteger();
        DefaultProcessFactory defaults = new DefaultProcessFactory(transport);
        ProcessFactory factory = (spec, plan) -> {
            if (spec.getName().equals(READER) && readers.incrementAndGet() > 1) {
                return new DuplicatingProcess(spec.getName(), plan.getRegistry().getName());
            }
            return defaults.create(spec, plan);
        };
        supervisor = new StargateSupervisor(new SupervisionPlanner().plan(config()), factory);
        supervisor.start();

        supervisor.terminateChild(READER);

        Await.until("supervisor failed", () -> supervisor.getState() == SupervisorState.FAILED);
        Await.until("all connections are closed", () -> transport.openConnections() == 0);
        assertFalse(supervisor.getRegistry().isOpen());
    }

    @Test
    public void stopTerminatesAllChildrenAndIsIdempotent() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);
        supervisor.stop();

        assertEquals(SupervisorState.STOPPED, supervisor.getState());
        assertEquals(0, transport.openConnections());
        assertTrue(supervisor.getRegistry().registeredNames().isEmpty());
        for (ProcessName name : CONNECTIONS) {
            assertTrue(child(name).getExitFuture().get().isShutdown());
            assertEquals(0, supervisor.getRestartCount(name));
        }
        supervisor.stop();
        assertFalse("transport passed in by the caller stays open", transport.isClosed());
        assertFalse(supervisor.terminateChild(READER));
    }

    @Test
    public void producersAreAddressableByName() throws Exception {
        supervisor = StargateSupervisor.start(config(), transport);

        Stargate.produce(supervisor.getRegistry(), PRODUCER_1, "{\"payload\":\"eA==\"}").get();
        assertEquals(List.of("{\"payload\":\"eA==\"}"), transport.latest("/default/b").orElseThrow().getSentTexts());

        // the handle resolves to the restarted process
        transport.latest("/default/b").orElseThrow().closeRemotely(1011, "unexpected");
        Await.until("producer-1 was restarted", () -> supervisor.getRestartCount(PRODUCER_1) == 1);
        awaitAllRegistered();
        Stargate.send(supervisor.getRegistry().via(PRODUCER_1), "again").get();
        assertEquals(List.of("again"), transport.latest("/default/b").orElseThrow().getSentTexts());
    }

    @Test
    public void sendingToAnUnknownNameFails() {
        CompletableFuture<Void> sent = Stargate.send(
                new SupervisionPlanner().plan(config()).getRegistry().via(ProcessName.of("nobody")), "x");
        assertTrue(sent.isCompletedExceptionally());
    }

    @Test
    public void readsJsonConfiguration() throws Exception {
        String json = "{\"name\": \"json\", \"host\": [\"localhost\", 8080],"
                + "\"transport_opts\": {\"auth_token\": \"t\"},"
                + "\"reader\": {\"tenant\": \"public\", \"namespace\": \"default\", \"topic\": \"d\","
                + "             \"query_params\": {\"starting_message\": \"earliest\"}}}";
        supervisor = StargateSupervisor.start(new ClientConfigReader().read(json), transport);
        assertEquals("ws://localhost:8080/ws/v2/reader/persistent/public/default/d?messageId=earliest",
                transport.getConnections().get(0).getUri().toString());
    }

    /**
     * A process whose start fails as if its name were taken.
     */
    private static class DuplicatingProcess implements SupervisedProcess {
        private final ProcessName name;
        private final String registryName;
        private final CompletableFuture<ExitReason> exitFuture = new CompletableFuture<>();

        DuplicatingProcess(ProcessName name, String registryName) {
            this.name = name;
            this.registryName = registryName;
        }

        @Override
        public ProcessName getName() {
            return name;
        }

        @Override
        public void start() {
            DuplicateRegistrationException failure = new DuplicateRegistrationException(registryName, name.toString());
            exitFuture.complete(ExitReason.error(failure));
            throw failure;
        }

        @Override
        public void stop() {
            exitFuture.complete(ExitReason.shutdown());
        }

        @Override
        public void kill(String reason) {
            exitFuture.complete(ExitReason.killed(reason));
        }

        @Override
        public boolean isAlive() {
            return false;
        }

        @Override
        public CompletableFuture<ExitReason> getExitFuture() {
            return exitFuture;
        }
    }
}
