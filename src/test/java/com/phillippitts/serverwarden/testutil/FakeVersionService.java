package com.phillippitts.serverwarden.testutil;

import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.exception.ActionExecutionException;
import com.phillippitts.serverwarden.service.version.UpdateResult;
import com.phillippitts.serverwarden.service.version.VersionCheck;
import com.phillippitts.serverwarden.service.version.VersionService;

/**
 * Test double for VersionService with canned build ids and update outcome.
 */
public class FakeVersionService implements VersionService {
    public String installed = "100";
    public String latest = "100";
    public boolean failCheck;
    public UpdateResult updateResult = UpdateResult.ok();
    public int checks;
    public int updates;

    @Override
    public VersionCheck checkAvailable() {
        checks++;
        if (failCheck) {
            throw new ActionExecutionException("Latest build lookup failed", ActionKind.UPDATE);
        }
        return VersionCheck.of(installed, latest);
    }

    @Override
    public UpdateResult update() {
        updates++;
        if (updateResult.success()) {
            installed = latest;
        }
        return updateResult;
    }
}
