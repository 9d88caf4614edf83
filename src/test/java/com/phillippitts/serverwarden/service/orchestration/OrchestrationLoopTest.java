package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.config.properties.PerformanceThresholds;
import com.phillippitts.serverwarden.config.properties.RecoveryProperties;
import com.phillippitts.serverwarden.config.properties.ScheduleProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties.ControlTool;
import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.domain.Audience;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.exception.ServiceControlException.Severity;
import com.phillippitts.serverwarden.service.command.QueueCommandSource;
import com.phillippitts.serverwarden.service.control.ServiceControlJournal;
import com.phillippitts.serverwarden.service.logs.LogEventParser;
import com.phillippitts.serverwarden.service.metrics.WardenMetrics;
import com.phillippitts.serverwarden.service.notify.NotificationKeys;
import com.phillippitts.serverwarden.service.recovery.AutoRecoveryController;
import com.phillippitts.serverwarden.service.recovery.JournalStopEvidence;
import com.phillippitts.serverwarden.service.schedule.PeriodicScheduler;
import com.phillippitts.serverwarden.service.schedule.ScheduledAction;
import com.phillippitts.serverwarden.service.schedule.ScheduledActionRegistry;
import com.phillippitts.serverwarden.service.status.PerformanceClassifier;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import com.phillippitts.serverwarden.testutil.FakeBackupService;
import com.phillippitts.serverwarden.testutil.FakeLogSource;
import com.phillippitts.serverwarden.testutil.FakeServiceController;
import com.phillippitts.serverwarden.testutil.FakeVersionService;
import com.phillippitts.serverwarden.testutil.MutableClock;
import com.phillippitts.serverwarden.testutil.RecordingNotifier;
import com.phillippitts.serverwarden.testutil.RecordingNotifier.Sent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationLoopTest {

    private static final Instant T0 = Instant.parse("2024-10-17T14:00:00Z");
    private static final String STARTED_LINE = "[17-10-24 13:50:00.000] LOG  : General     , *** SERVER STARTED ***";

    private MutableClock clock;
    private FakeServiceController controller;
    private FakeLogSource logSource;
    private FakeVersionService versions;
    private FakeBackupService backups;
    private RecordingNotifier notifier;
    private SimpleMeterRegistry meterRegistry;
    private ScheduleProperties scheduleProperties;

    private ServerStatusMachine statusMachine;
    private QueueCommandSource commands;
    private ScheduledActionRegistry registry;
    private AutoRecoveryController recovery;
    private OrchestrationLoop loop;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0, ZoneOffset.UTC);
        controller = new FakeServiceController(true);
        logSource = new FakeLogSource();
        versions = new FakeVersionService();
        backups = new FakeBackupService();
        notifier = new RecordingNotifier();
        meterRegistry = new SimpleMeterRegistry();
        scheduleProperties = new ScheduleProperties();
        scheduleProperties.setBackupIntervalMinutes(0);
        scheduleProperties.setUpdateCheckIntervalMinutes(0);
    }

    /** Wires the loop from the current fakes and properties; call after adjusting them. */
    private void build() {
        ServerProperties server = new ServerProperties("pzserver", "console.txt", "/opt/pz", "/opt/pz/Saves",
                10, 60, ControlTool.SYSTEMCTL);
        LoopProperties loopProperties = new LoopProperties();
        ServiceControlJournal journal = new ServiceControlJournal(clock);
        statusMachine = new ServerStatusMachine(new PerformanceClassifier(new PerformanceThresholds(30, 20, 15, 10)),
                clock, loopProperties);
        commands = new QueueCommandSource(clock);
        registry = new ScheduledActionRegistry(clock);
        PeriodicScheduler periodic = new PeriodicScheduler(scheduleProperties, clock);
        recovery = new AutoRecoveryController(new RecoveryProperties(),
                new JournalStopEvidence(journal, statusMachine, clock), server);
        WardenMetrics metrics = new WardenMetrics(meterRegistry);
        ActionExecutor executor = new ActionExecutor(controller, versions, backups, statusMachine, recovery, journal,
                notifier, metrics, server);
        loop = new OrchestrationLoop(controller, logSource, new LogEventParser(clock), statusMachine, commands,
                registry, periodic, recovery, versions, executor, notifier, new SleepPolicy(loopProperties),
                metrics, loopProperties, scheduleProperties);
    }

    private TickResult tickAt(Duration sinceT0) {
        clock.set(T0.plus(sinceT0));
        return loop.tick(clock.instant());
    }

    private long startCalls() {
        return controller.calls.stream().filter("start"::equals).count();
    }

    private void startOnline() {
        logSource.tail.add(STARTED_LINE);
        build();
        tickAt(Duration.ZERO);
    }

    @Test
    void firstTickReconcilesFromLogTailWithoutAnnouncing() {
        logSource.tail.add(STARTED_LINE);
        logSource.append("*** SERVER STARTED ***");
        build();

        TickResult result = tickAt(Duration.ZERO);

        assertThat(loop.isInitialized()).isTrue();
        assertThat(logSource.seekedToEnd).isTrue();
        assertThat(statusMachine.current().kind()).isEqualTo(StatusKind.ONLINE);
        assertThat(notifier.sent).isEmpty();
        assertThat(result.actionTaken()).isFalse();
        assertThat(result.running()).isTrue();
        assertThat(result.sleep()).isEqualTo(Duration.ofMillis(5000));
    }

    @Test
    void stoppedServerIsRestartedByRecovery() {
        controller.running = false;
        logSource.tail.add(STARTED_LINE);
        build();

        TickResult result = tickAt(Duration.ZERO);

        assertThat(result.actionTaken()).isTrue();
        assertThat(controller.calls).containsExactly("start");
        assertThat(notifier.keys()).containsExactly(NotificationKeys.RECOVERY_RESTARTED);
        assertThat(meterRegistry.get("warden.recovery.attempts").counter().count()).isEqualTo(1.0);
        assertThat(result.sleep()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void cleanShutdownInLogTailIsTreatedAsIntentional() {
        controller.running = false;
        logSource.tail.add(STARTED_LINE);
        logSource.tail.add("[17-10-24 13:58:00.000] LOG  : General     , Server interrupted by signal");
        build();

        tickAt(Duration.ZERO);
        tickAt(Duration.ofMinutes(1));

        assertThat(controller.calls).isEmpty();
        assertThat(notifier.keys()).containsExactly(NotificationKeys.RECOVERY_INTENTIONAL_STOP);
    }

    @Test
    void adminStartAfterIntentionalStopBringsServerBack() {
        controller.running = false;
        logSource.tail.add("[17-10-24 13:58:00.000] LOG  : General     , Server interrupted by signal");
        build();
        tickAt(Duration.ZERO);
        notifier.clear();

        commands.start("alice");
        TickResult result = tickAt(Duration.ofMinutes(1));

        assertThat(result.actionTaken()).isTrue();
        assertThat(controller.calls).containsExactly("start");
        assertThat(notifier.keys()).containsExactly(NotificationKeys.SERVER_STARTED);
        assertThat(recovery.state().intentionallyStopped()).isFalse();
    }

    @Test
    void lifecycleTransitionsAreAnnouncedToTheRightAudience() {
        build();
        tickAt(Duration.ZERO);

        logSource.append("LOG  : General     , Loading world...");
        tickAt(Duration.ofMinutes(1));
        logSource.append("LOG  : General     , *** SERVER STARTED ***");
        tickAt(Duration.ofMinutes(3));

        List<Sent> changes = notifier.withKey(NotificationKeys.STATUS_CHANGED);
        assertThat(changes).extracting(Sent::audience).containsExactly(Audience.ADMIN, Audience.PLAYER);
        assertThat(changes.get(1).payload()).containsEntry("to", "Online");
        assertThat(recovery.isAwaitingStartup()).isFalse();
        assertThat(meterRegistry.get("warden.status.transitions").tag("to", "online").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void onlineDuringStartupGraceIsNotAnnounced() {
        build();
        tickAt(Duration.ZERO);

        logSource.append("*** SERVER STARTED ***");
        tickAt(Duration.ofSeconds(30));

        assertThat(statusMachine.current().kind()).isEqualTo(StatusKind.ONLINE);
        assertThat(notifier.withKey(NotificationKeys.STATUS_CHANGED)).isEmpty();
    }

    @Test
    void serverThatNeverComesOnlineRaisesStartupTimeoutOnce() {
        build();
        tickAt(Duration.ZERO);

        tickAt(Duration.ofMinutes(9));
        assertThat(notifier.withKey(NotificationKeys.STARTUP_TIMEOUT)).isEmpty();

        tickAt(Duration.ofMinutes(10));
        tickAt(Duration.ofMinutes(11));
        assertThat(notifier.withKey(NotificationKeys.STARTUP_TIMEOUT)).hasSize(1);
    }

    @Test
    void scheduledRestartCountsDownAndExecutes() {
        startOnline();

        commands.schedule(ActionKind.RESTART, 15, "alice");
        for (int minute = 0; minute <= 15; minute++) {
            tickAt(Duration.ofMinutes(minute));
        }

        assertThat(notifier.withKey(NotificationKeys.ACTION_SCHEDULED)).hasSize(1);
        List<Sent> warnings = notifier.withKey(NotificationKeys.ACTION_WARNING);
        assertThat(warnings).extracting(s -> s.payload().get("minutes")).containsExactly(10, 5, 1);
        assertThat(warnings).allMatch(s -> s.audience() == Audience.PLAYER);
        assertThat(warnings.get(0).message()).isEqualTo("Server restart in 10 minutes");
        assertThat(controller.calls).containsExactly("restart");
        assertThat(notifier.withKey(NotificationKeys.ACTION_COMPLETED)).hasSize(1);
        assertThat(registry.pendingActions()).isEmpty();
    }

    @Test
    void pendingActionNearbyUsesFastCadence() {
        startOnline();

        commands.schedule(ActionKind.STOP, 10, "alice");
        TickResult result = tickAt(Duration.ofMinutes(1));

        assertThat(result.sleep()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void cancelRemovesPendingAction() {
        startOnline();

        commands.schedule(ActionKind.STOP, 30, "alice");
        tickAt(Duration.ofMinutes(1));
        commands.cancel(ActionKind.STOP, "bob");
        commands.cancel(ActionKind.UPDATE, "bob");
        tickAt(Duration.ofMinutes(2));

        assertThat(registry.pendingActions()).isEmpty();
        assertThat(notifier.withKey(NotificationKeys.ACTION_CANCELLED)).extracting(Sent::message)
                .containsExactly("Stop cancelled by bob", "No pending update to cancel");
    }

    @Test
    void serverOperationDefersOtherDueActionsToNextTick() {
        startOnline();

        registry.schedule(ActionKind.RESTART, 0, "alice", T0);
        commands.start("bob");
        TickResult first = tickAt(Duration.ofSeconds(1));

        assertThat(first.actionTaken()).isTrue();
        assertThat(controller.calls).isEmpty();
        assertThat(registry.pending(ActionKind.RESTART)).isPresent();

        tickAt(Duration.ofSeconds(2));

        assertThat(controller.calls).containsExactly("restart");
    }

    @Test
    void periodicRestartWarnsBacksUpAndRestarts() {
        scheduleProperties.setRestartTimes(List.of("14:15"));
        startOnline();

        tickAt(Duration.ofMinutes(10));
        tickAt(Duration.ofMinutes(14));
        tickAt(Duration.ofMinutes(15));

        assertThat(notifier.withKey(NotificationKeys.PERIODIC_RESTART_WARNING)).extracting(Sent::message)
                .containsExactly("Scheduled server restart in 15 minutes",
                        "Scheduled server restart in 5 minutes",
                        "Scheduled server restart in 1 minute");
        assertThat(backups.sources).hasSize(1);
        assertThat(controller.calls).containsExactly("restart");
        assertThat(notifier.withKey(NotificationKeys.PERIODIC_RESTART_COMPLETED)).hasSize(1);
    }

    @Test
    void skippedPeriodicRestartIsNotExecuted() {
        scheduleProperties.setRestartTimes(List.of("14:15"));
        logSource.tail.add(STARTED_LINE);
        build();

        commands.skipNextPeriodicRestart("alice");
        tickAt(Duration.ZERO);
        tickAt(Duration.ofMinutes(10));
        tickAt(Duration.ofMinutes(15));

        assertThat(notifier.withKey(NotificationKeys.PERIODIC_RESTART_SKIP_REQUESTED)).hasSize(1);
        assertThat(notifier.withKey(NotificationKeys.PERIODIC_RESTART_WARNING)).isEmpty();
        assertThat(notifier.withKey(NotificationKeys.PERIODIC_RESTART_SKIPPED)).hasSize(1);
        assertThat(controller.calls).isEmpty();
    }

    @Test
    void availableUpdateIsScheduledImmediatelyWhenNobodyIsOnline() {
        scheduleProperties.setUpdateCheckIntervalMinutes(30);
        versions.latest = "101";
        startOnline();

        tickAt(Duration.ofMinutes(30));

        ScheduledAction update = registry.pending(ActionKind.UPDATE).orElseThrow();
        assertThat(update.requestedBy()).isEqualTo(OrchestrationLoop.UPDATE_CHECKER);
        assertThat(update.scheduledAt()).isEqualTo(T0.plus(Duration.ofMinutes(30)));
        assertThat(notifier.withKey(NotificationKeys.ACTION_SCHEDULED).get(0).message()).contains("100 -> 101");

        tickAt(Duration.ofMinutes(31));

        assertThat(controller.calls).containsExactly("stop", "start");
        assertThat(versions.installed).isEqualTo("101");
    }

    @Test
    void availableUpdateWaitsWhilePlayersAreOnline() {
        scheduleProperties.setUpdateCheckIntervalMinutes(30);
        scheduleProperties.setUpdateDelayMinutes(15);
        versions.latest = "101";
        logSource.tail.add("[17-10-24 13:55:00.000] GlobalStats: fps=30 players=3");
        build();
        tickAt(Duration.ZERO);

        tickAt(Duration.ofMinutes(30));

        assertThat(registry.pending(ActionKind.UPDATE)).map(ScheduledAction::scheduledAt)
                .contains(T0.plus(Duration.ofMinutes(45)));
        assertThat(controller.calls).isEmpty();
    }

    @Test
    void failedUpdateCheckIsReported() {
        scheduleProperties.setUpdateCheckIntervalMinutes(30);
        versions.failCheck = true;
        startOnline();

        tickAt(Duration.ofMinutes(30));

        assertThat(notifier.withKey(NotificationKeys.UPDATE_CHECK_FAILED)).hasSize(1);
        assertThat(registry.pendingActions()).isEmpty();
    }

    @Test
    void periodicBackupRunsOnItsInterval() {
        scheduleProperties.setBackupIntervalMinutes(60);
        startOnline();

        tickAt(Duration.ofMinutes(59));
        tickAt(Duration.ofMinutes(60));
        tickAt(Duration.ofMinutes(61));

        assertThat(backups.sources).hasSize(1);
        assertThat(notifier.keys()).containsExactly(NotificationKeys.BACKUP_COMPLETED);
    }

    @Test
    void unknownServiceStateSkipsRecovery() {
        startOnline();
        controller.running = false;
        controller.queryFailure = new ServiceControlException("is-active timed out", "pzserver", "is-active",
                Severity.TRANSIENT);

        TickResult result = tickAt(Duration.ofMinutes(1));

        assertThat(result.running()).isTrue();
        assertThat(result.actionTaken()).isFalse();
        assertThat(controller.calls).isEmpty();
    }

    @Test
    void crashLoopBeforeComingOnlineStopsAtTheAttemptBudget() {
        startOnline();

        for (int cycle = 0; cycle < 6; cycle++) {
            int crashMinute = 1 + 5 * cycle;
            controller.running = false;
            tickAt(Duration.ofMinutes(crashMinute));
            tickAt(Duration.ofMinutes(crashMinute + 1));
        }

        assertThat(startCalls()).isEqualTo(3);
        assertThat(recovery.state().consecutiveAttempts()).isEqualTo(3);
        assertThat(recovery.state().isExhausted()).isTrue();
        assertThat(notifier.withKey(NotificationKeys.RECOVERY_EXHAUSTED)).hasSize(1);
        assertThat(statusMachine.current().kind()).isNotEqualTo(StatusKind.ONLINE);
    }

    @Test
    void crashWithoutLogLinesTakesTheStatusOffline() {
        startOnline();

        controller.running = false;
        tickAt(Duration.ofMinutes(1));

        List<Sent> changes = notifier.withKey(NotificationKeys.STATUS_CHANGED);
        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).audience()).isEqualTo(Audience.PLAYER);
        assertThat(changes.get(0).payload()).containsEntry("from", "Online").containsEntry("to", "Offline");
        assertThat(controller.calls).containsExactly("start");
    }

    @Test
    void onlyTheNewLifecycleComingOnlineResetsTheBudget() {
        startOnline();

        controller.running = false;
        tickAt(Duration.ofMinutes(1));
        tickAt(Duration.ofMinutes(2));
        controller.running = false;
        tickAt(Duration.ofMinutes(6));
        tickAt(Duration.ofMinutes(7));
        assertThat(recovery.state().consecutiveAttempts()).isEqualTo(2);

        logSource.append("LOG  : General     , *** SERVER STARTED ***");
        tickAt(Duration.ofMinutes(8));
        assertThat(recovery.state().consecutiveAttempts()).isZero();
        assertThat(recovery.isAwaitingStartup()).isFalse();

        controller.running = false;
        TickResult result = tickAt(Duration.ofMinutes(9));

        assertThat(result.actionTaken()).isTrue();
        assertThat(startCalls()).isEqualTo(3);
        assertThat(recovery.state().consecutiveAttempts()).isEqualTo(1);
    }

    @Test
    void crashShortlyAfterAnUpdateIsRecovered() {
        scheduleProperties.setUpdateCheckIntervalMinutes(30);
        versions.latest = "101";
        startOnline();
        tickAt(Duration.ofMinutes(30));
        tickAt(Duration.ofMinutes(31));
        assertThat(controller.calls).containsExactly("stop", "start");

        logSource.append("LOG  : General     , Server interrupted by signal",
                "LOG  : General     , *** SERVER STARTED ***");
        tickAt(Duration.ofMinutes(32));
        assertThat(statusMachine.current().kind()).isEqualTo(StatusKind.ONLINE);

        controller.running = false;
        tickAt(Duration.ofMinutes(35));

        assertThat(controller.calls).containsExactly("stop", "start", "start");
        assertThat(notifier.withKey(NotificationKeys.RECOVERY_INTENTIONAL_STOP)).isEmpty();
        assertThat(recovery.state().intentionallyStopped()).isFalse();
    }

    @Test
    void newProcessDyingBeforeItLogsIsNotMistakenForTheOldShutdown() {
        startOnline();
        registry.schedule(ActionKind.RESTART, 0, "alice", T0);
        tickAt(Duration.ofMinutes(1));
        assertThat(controller.calls).containsExactly("restart");

        logSource.append("LOG  : General     , Server interrupted by signal");
        controller.running = false;
        tickAt(Duration.ofMinutes(2));

        assertThat(controller.calls).containsExactly("restart", "start");
        assertThat(notifier.withKey(NotificationKeys.RECOVERY_INTENTIONAL_STOP)).isEmpty();
    }

    @Test
    void crashAfterAdminStopAndStartIsRecovered() {
        startOnline();
        registry.schedule(ActionKind.STOP, 0, "alice", T0);
        tickAt(Duration.ofMinutes(1));
        tickAt(Duration.ofMinutes(2));
        assertThat(controller.calls).containsExactly("stop");

        commands.start("alice");
        tickAt(Duration.ofMinutes(3));
        logSource.append("LOG  : General     , *** SERVER STARTED ***");
        tickAt(Duration.ofMinutes(4));

        controller.running = false;
        tickAt(Duration.ofMinutes(6));

        assertThat(controller.calls).containsExactly("stop", "start", "start");
        assertThat(recovery.state().consecutiveAttempts()).isEqualTo(1);
    }

    @Test
    void warningTextNamesTheAction() {
        assertThat(OrchestrationLoop.warningText(ActionKind.STOP, 1)).isEqualTo("Server shutdown in 1 minute");
        assertThat(OrchestrationLoop.warningText(ActionKind.UPDATE, 5))
                .isEqualTo("Server update in 5 minutes; the server will restart");
    }
}
