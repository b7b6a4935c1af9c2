package com.agentdock.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    private static RepoEntry repo(String id, RepoStatus status) {
        RepoEntry entry = new RepoEntry(id, id, RepoKind.LOCAL, "/src/" + id, null);
        entry.setStatus(status);
        return entry;
    }

    @Nested
    @DisplayName("derive")
    class Derive {

        @Test
        @DisplayName("live processes keep the task running even when every repo looks finished")
        void liveProcessesWin() {
            assertEquals(TaskStatus.RUNNING, TaskStatus.derive(List.of(repo("a", RepoStatus.DONE)), 1));
        }

        @Test
        @DisplayName("an in-flight repo keeps the task running")
        void inFlightRepo() {
            assertEquals(TaskStatus.RUNNING,
                    TaskStatus.derive(List.of(repo("a", RepoStatus.DONE), repo("b", RepoStatus.PREPARING)), 0));
            assertEquals(TaskStatus.RUNNING, TaskStatus.derive(List.of(repo("a", RepoStatus.PENDING)), 0));
        }

        @Test
        @DisplayName("error beats canceled and done")
        void errorWins() {
            var repos = List.of(repo("a", RepoStatus.DONE), repo("b", RepoStatus.CANCELED), repo("c", RepoStatus.ERROR));
            assertEquals(TaskStatus.ERROR, TaskStatus.derive(repos, 0));
        }

        @Test
        @DisplayName("canceled beats done")
        void canceledBeatsDone() {
            var repos = List.of(repo("a", RepoStatus.DONE), repo("b", RepoStatus.CANCELED));
            assertEquals(TaskStatus.CANCELED, TaskStatus.derive(repos, 0));
        }

        @Test
        @DisplayName("all done, or no repos at all, is done")
        void allDone() {
            assertEquals(TaskStatus.DONE,
                    TaskStatus.derive(List.of(repo("a", RepoStatus.DONE), repo("b", RepoStatus.DONE)), 0));
            assertEquals(TaskStatus.DONE, TaskStatus.derive(List.of(), 0));
        }
    }

    @Test
    void wireNamesAreLowercase() {
        assertEquals("canceled", TaskStatus.CANCELED.wireName());
        assertEquals("preparing", RepoStatus.PREPARING.wireName());
    }

    @Test
    void resumableRepoStatuses() {
        assertTrue(RepoStatus.ERROR.isResumable());
        assertTrue(RepoStatus.RUNNING.isResumable());
        assertFalse(RepoStatus.DONE.isResumable());
        assertFalse(RepoStatus.CANCELED.isResumable());
    }

    @Test
    void repoKindParsesWireNames() {
        assertEquals(RepoKind.GIT, RepoKind.fromWireName("git").orElseThrow());
        assertEquals(RepoKind.LOCAL, RepoKind.fromWireName("LOCAL").orElseThrow());
        assertTrue(RepoKind.fromWireName("svn").isEmpty());
        assertTrue(RepoKind.fromWireName(null).isEmpty());
    }
}
