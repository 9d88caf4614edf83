package com.phillippitts.serverwarden.presentation.controller;

import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.domain.AdminCommand;
import com.phillippitts.serverwarden.presentation.dto.CommandAccepted;
import com.phillippitts.serverwarden.presentation.dto.PendingActionView;
import com.phillippitts.serverwarden.presentation.dto.StatusResponse;
import com.phillippitts.serverwarden.service.command.QueueCommandSource;
import com.phillippitts.serverwarden.service.recovery.AutoRecoveryController;
import com.phillippitts.serverwarden.service.schedule.PeriodicScheduler;
import com.phillippitts.serverwarden.service.schedule.ScheduledActionRegistry;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin API. Mutating endpoints only queue commands; the orchestration loop applies them on its
 * next tick, so all scheduling state keeps a single writer.
 *
 * <p>The requesting administrator comes from {@code requestedBy}, else the {@code X-Admin-User}
 * header.
 */
@RestController
@RequestMapping("/api")
class AdminController {

    private static final Logger LOG = LogManager.getLogger(AdminController.class);

    private final QueueCommandSource commands;
    private final ServerStatusMachine statusMachine;
    private final ScheduledActionRegistry registry;
    private final PeriodicScheduler periodic;
    private final AutoRecoveryController recovery;

    AdminController(QueueCommandSource commands,
                    ServerStatusMachine statusMachine,
                    ScheduledActionRegistry registry,
                    PeriodicScheduler periodic,
                    AutoRecoveryController recovery) {
        this.commands = commands;
        this.statusMachine = statusMachine;
        this.registry = registry;
        this.periodic = periodic;
        this.recovery = recovery;
    }

    @PostMapping("/actions/{kind}")
    ResponseEntity<CommandAccepted> schedule(@PathVariable String kind,
                                             @RequestParam(defaultValue = "0") int delayMinutes,
                                             @RequestParam(required = false) String requestedBy,
                                             @RequestHeader(value = "X-Admin-User", required = false) String adminUser) {
        AdminCommand command = commands.schedule(ActionKind.fromKey(kind), delayMinutes, who(requestedBy, adminUser));
        return accepted(command);
    }

    @DeleteMapping("/actions/{kind}")
    ResponseEntity<CommandAccepted> cancel(@PathVariable String kind,
                                           @RequestParam(required = false) String requestedBy,
                                           @RequestHeader(value = "X-Admin-User", required = false) String adminUser) {
        return accepted(commands.cancel(ActionKind.fromKey(kind), who(requestedBy, adminUser)));
    }

    @PostMapping("/periodic/skip-next")
    ResponseEntity<CommandAccepted> skipNext(@RequestParam(required = false) String requestedBy,
                                             @RequestHeader(value = "X-Admin-User", required = false) String adminUser) {
        return accepted(commands.skipNextPeriodicRestart(who(requestedBy, adminUser)));
    }

    @PostMapping("/server/start")
    ResponseEntity<CommandAccepted> start(@RequestParam(required = false) String requestedBy,
                                          @RequestHeader(value = "X-Admin-User", required = false) String adminUser) {
        return accepted(commands.start(who(requestedBy, adminUser)));
    }

    @GetMapping("/actions")
    List<PendingActionView> pending() {
        return registry.pendingActions().stream().map(PendingActionView::from).toList();
    }

    @GetMapping("/status")
    StatusResponse status() {
        return new StatusResponse(statusMachine.current(), recovery.state(),
                periodic.nextRestartAt().orElse(null), periodic.isSkipNextRequested(), pending());
    }

    private static ResponseEntity<CommandAccepted> accepted(AdminCommand command) {
        LOG.debug("Accepted command #{}", command.sequence());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(CommandAccepted.from(command));
    }

    private static String who(String requestedBy, String adminUser) {
        if (requestedBy != null && !requestedBy.isBlank()) {
            return requestedBy;
        }
        return adminUser;
    }
}
