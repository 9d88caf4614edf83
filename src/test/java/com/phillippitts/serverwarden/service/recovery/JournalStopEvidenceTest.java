package com.phillippitts.serverwarden.service.recovery;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.config.properties.PerformanceThresholds;
import com.phillippitts.serverwarden.domain.LogEvent;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.service.control.ServiceControlJournal;
import com.phillippitts.serverwarden.service.control.ServiceControlJournal.Operation;
import com.phillippitts.serverwarden.service.status.PerformanceClassifier;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import com.phillippitts.serverwarden.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JournalStopEvidenceTest {

    private static final Instant T0 = Instant.parse("2024-10-17T03:00:00Z");

    private MutableClock clock;
    private ServiceControlJournal journal;
    private ServerStatusMachine statusMachine;
    private JournalStopEvidence evidence;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0, ZoneOffset.UTC);
        journal = new ServiceControlJournal(clock);
        statusMachine = new ServerStatusMachine(new PerformanceClassifier(new PerformanceThresholds(30, 20, 15, 10)),
                clock, new LoopProperties());
        evidence = new JournalStopEvidence(journal, statusMachine, clock);
    }

    @Test
    void recentJournaledStopIsIntentional() {
        journal.record("pzserver", Operation.STOP, "stop requested by alice");
        clock.advance(Duration.ofMinutes(5));

        assertThat(evidence.assess("pzserver", 10)).isTrue();
    }

    @Test
    void journaledStopOutsideWindowIsNotEvidence() {
        journal.record("pzserver", Operation.STOP, "stop requested by alice");
        clock.advance(Duration.ofMinutes(11));

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }

    @Test
    void stopOfAnotherServiceIsNotEvidence() {
        journal.record("other", Operation.STOP, "unrelated");

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }

    @Test
    void restartIsNotAStop() {
        journal.record("pzserver", Operation.RESTART, "periodic restart");

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }

    @Test
    void recentOrderlyShutdownInLogIsIntentional() {
        statusMachine.apply(LogEvent.of(T0, StatusKind.ONLINE));
        statusMachine.apply(LogEvent.of(T0.plusSeconds(60), StatusKind.SHUTTING_DOWN));
        clock.advance(Duration.ofMinutes(3));

        assertThat(evidence.assess("pzserver", 10)).isTrue();
    }

    @Test
    void crashWithoutAnyEvidenceIsNotIntentional() {
        statusMachine.apply(LogEvent.of(T0, StatusKind.ONLINE));
        clock.advance(Duration.ofMinutes(3));

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }

    @Test
    void stopFollowedByStartIsNotEvidence() {
        journal.record("pzserver", Operation.STOP, "update requested by update-checker");
        journal.record("pzserver", Operation.START, "update requested by update-checker");
        clock.advance(Duration.ofMinutes(4));

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }

    @Test
    void shutdownLoggedBeforeTheLatestStartIsNotEvidence() {
        statusMachine.apply(LogEvent.of(T0, StatusKind.ONLINE));
        statusMachine.apply(LogEvent.of(T0.plusSeconds(60), StatusKind.SHUTTING_DOWN));
        clock.advance(Duration.ofMinutes(2));
        journal.record("pzserver", Operation.START, "auto-recovery attempt 1");
        clock.advance(Duration.ofMinutes(1));

        assertThat(evidence.assess("pzserver", 10)).isFalse();
    }
}
