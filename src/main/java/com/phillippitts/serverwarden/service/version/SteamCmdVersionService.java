package com.phillippitts.serverwarden.service.version;

import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.config.properties.UpdateProperties;
import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.exception.ActionExecutionException;
import com.phillippitts.serverwarden.exception.CommandExecutionException;
import com.phillippitts.serverwarden.service.control.CommandResult;
import com.phillippitts.serverwarden.service.control.CommandRunner;
import com.phillippitts.serverwarden.util.LogSanitizer;
import com.phillippitts.serverwarden.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link VersionService} backed by SteamCMD.
 *
 * <p>The installed build id is read from {@code steamapps/appmanifest_<appId>.acf} in the install
 * directory. The latest build id is the {@code buildid} of the configured branch in the
 * {@code +app_info_print} output. An update succeeds when SteamCMD exits 0 and prints its
 * {@code Success!} line.
 */
@Component
public class SteamCmdVersionService implements VersionService {

    private static final Logger LOG = LogManager.getLogger(SteamCmdVersionService.class);

    private static final Pattern BUILD_ID = Pattern.compile("\"buildid\"\\s+\"(\\d+)\"");
    private static final String SUCCESS_MARKER = "Success!";

    private final CommandRunner runner;
    private final UpdateProperties props;
    private final Path installDirectory;

    public SteamCmdVersionService(CommandRunner runner, UpdateProperties props, ServerProperties serverProperties) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
        this.installDirectory = Paths.get(serverProperties.installDirectory());
    }

    @Override
    public VersionCheck checkAvailable() {
        String installed = installedBuild();
        String latest = latestBuild();
        VersionCheck check = VersionCheck.of(installed, latest);
        LOG.info("Version check: installed={}, latest={}, updateAvailable={}", installed, latest, check.available());
        return check;
    }

    @Override
    public UpdateResult update() {
        List<String> command = List.of(props.steamcmdPath(),
                "+force_install_dir", installDirectory.toAbsolutePath().toString(),
                "+login", "anonymous",
                "+app_update", props.appId(), "validate",
                "+quit");
        LOG.info("Updating app {} in {}", props.appId(), installDirectory.toAbsolutePath());
        try {
            CommandResult r = runner.run(command, null, Duration.ofSeconds(props.timeoutSeconds()));
            if (r.succeeded() && r.stdout().contains(SUCCESS_MARKER)) {
                LOG.info("Update finished in {}s", r.durationMs() / 1000);
                return UpdateResult.ok();
            }
            String detail = "SteamCMD exited " + r.exitCode() + ": " + lastLine(r.combinedOutput());
            LOG.warn("Update failed: {}", detail);
            return UpdateResult.failed(detail);
        } catch (CommandExecutionException e) {
            LOG.warn("Update failed: {}", e.getMessage());
            return UpdateResult.failed(e.getMessage());
        }
    }

    /**
     * @return build id from the installed app manifest, or null if missing or unreadable
     */
    String installedBuild() {
        Path manifest = installDirectory.resolve("steamapps").resolve("appmanifest_" + props.appId() + ".acf");
        if (!Files.isRegularFile(manifest)) {
            LOG.warn("App manifest not found: {}", manifest);
            return null;
        }
        try {
            Matcher m = BUILD_ID.matcher(Files.readString(manifest, StandardCharsets.UTF_8));
            return m.find() ? m.group(1) : null;
        } catch (IOException e) {
            LOG.warn("Cannot read app manifest {}: {}", manifest, e.toString());
            return null;
        }
    }

    String latestBuild() {
        List<String> command = List.of(props.steamcmdPath(),
                "+login", "anonymous",
                "+app_info_update", "1",
                "+app_info_print", props.appId(),
                "+quit");
        CommandResult r;
        try {
            r = runner.run(command, null, ProcessTimeouts.VERSION_QUERY_TIMEOUT);
        } catch (CommandExecutionException e) {
            throw new ActionExecutionException("Latest build lookup failed", ActionKind.UPDATE, e);
        }
        String build = parseBranchBuildId(r.stdout(), props.branch());
        if (build == null) {
            throw new ActionExecutionException("No build id for branch '" + props.branch()
                    + "' in SteamCMD output (exit " + r.exitCode() + ")", ActionKind.UPDATE);
        }
        return build;
    }

    /**
     * Finds the {@code buildid} inside the given branch block of {@code app_info_print} output.
     *
     * @return build id, or null if the branch or its build id is absent
     */
    static String parseBranchBuildId(String appInfo, String branch) {
        int branches = appInfo.indexOf("\"branches\"");
        if (branches < 0) {
            return null;
        }
        int branchStart = appInfo.indexOf("\"" + branch + "\"", branches);
        if (branchStart < 0) {
            return null;
        }
        int blockEnd = appInfo.indexOf('}', branchStart);
        String block = blockEnd < 0 ? appInfo.substring(branchStart) : appInfo.substring(branchStart, blockEnd);
        Matcher m = BUILD_ID.matcher(block);
        return m.find() ? m.group(1) : null;
    }

    private static String lastLine(String output) {
        String trimmed = output.strip();
        int nl = trimmed.lastIndexOf('\n');
        return LogSanitizer.preview(nl < 0 ? trimmed : trimmed.substring(nl + 1), 200);
    }
}
