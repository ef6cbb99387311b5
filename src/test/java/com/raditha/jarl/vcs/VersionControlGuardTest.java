package com.raditha.jarl.vcs;

import com.raditha.jarl.vcs.VersionControlGuard.CommandResult;
import com.raditha.jarl.vcs.VersionControlGuard.GuardResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for VersionControlGuard - git commands are stubbed on a spy.
 */
class VersionControlGuardTest {

    @TempDir
    Path dir;

    private static VersionControlGuard guard(boolean allowDirty, boolean allowNoVcs, CommandResult inside,
            CommandResult status) throws InterruptedException {
        VersionControlGuard guard = spy(new VersionControlGuard(allowDirty, allowNoVcs));
        doReturn(inside).when(guard).run(any(Path.class), eq("git"), eq("rev-parse"), eq("--is-inside-work-tree"));
        doReturn(status).when(guard).run(any(Path.class), eq("git"), eq("status"), eq("--porcelain"));
        return guard;
    }

    @Test
    void testBothFlagsSkipGit() throws InterruptedException {
        VersionControlGuard guard = spy(new VersionControlGuard(true, true));
        assertTrue(guard.check(dir).allowed());
        verify(guard, never()).run(any(Path.class), any(String.class), any(String.class), any(String.class));
    }

    @Test
    void testOutsideRepositoryRefused() throws InterruptedException {
        VersionControlGuard guard = guard(false, false, new CommandResult(false, "fatal: not a git repository"),
                new CommandResult(true, ""));
        GuardResult result = guard.check(dir);
        assertFalse(result.allowed());
        assertTrue(result.message().contains("--allow-no-vcs"));
    }

    @Test
    void testOutsideRepositoryAllowed() throws InterruptedException {
        VersionControlGuard guard = guard(false, true, new CommandResult(false, ""), new CommandResult(true, ""));
        assertTrue(guard.check(dir).allowed());
    }

    @Test
    void testCleanTree() throws InterruptedException {
        VersionControlGuard guard = guard(false, false, new CommandResult(true, "true\n"),
                new CommandResult(true, "\n"));
        assertTrue(guard.check(dir).allowed());
    }

    @Test
    void testDirtyTreeRefused() throws InterruptedException {
        VersionControlGuard guard = guard(false, false, new CommandResult(true, "true\n"),
                new CommandResult(true, " M R/utils.R\n?? R/new.R\n"));
        GuardResult result = guard.check(dir);
        assertFalse(result.allowed());
        assertTrue(result.message().contains("  - R/utils.R\n"));
        assertTrue(result.message().contains("  - R/new.R\n"));
        assertTrue(result.message().contains("--allow-dirty"));
    }

    @Test
    void testDirtyTreeAllowed() throws InterruptedException {
        VersionControlGuard guard = guard(true, false, new CommandResult(true, "true\n"),
                new CommandResult(true, " M R/utils.R\n"));
        assertTrue(guard.check(dir).allowed());
        verify(guard, never()).run(any(Path.class), eq("git"), eq("status"), eq("--porcelain"));
    }

    @Test
    void testStatusFailure() throws InterruptedException {
        VersionControlGuard guard = guard(false, false, new CommandResult(true, "true\n"),
                new CommandResult(false, "error"));
        assertFalse(guard.check(dir).allowed());
    }
}
