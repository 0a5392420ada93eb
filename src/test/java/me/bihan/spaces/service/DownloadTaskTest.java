package me.bihan.spaces.service;

import me.bihan.spaces.storage.FakeStorageClient;
import me.bihan.spaces.storage.StorageException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class DownloadTaskTest {

    @Test
    void attachSameListenerTwiceNotifiesOnce() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<String> calls = new ArrayList<>();
        TaskListener listener = t -> calls.add("update");

        task.attach(listener);
        task.attach(listener);
        task.notifyListeners();

        assertThat(calls).containsExactly("update");
    }

    @Test
    void detachOfUnknownListenerIsIgnored() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<String> calls = new ArrayList<>();
        task.attach(t -> calls.add("kept"));

        task.detach(t -> calls.add("never attached"));
        task.notifyListeners();

        assertThat(calls).containsExactly("kept");
    }

    @Test
    void detachedListenerIsNoLongerNotified() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<String> calls = new ArrayList<>();
        TaskListener listener = t -> calls.add("update");
        task.attach(listener);

        task.detach(listener);
        task.notifyListeners();

        assertThat(calls).isEmpty();
    }

    @Test
    void listenersAreNotifiedInAttachOrder() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<String> calls = new ArrayList<>();
        task.attach(t -> calls.add("first"));
        task.attach(t -> calls.add("second"));
        task.attach(t -> calls.add("third"));

        task.notifyListeners();

        assertThat(calls).containsExactly("first", "second", "third");
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<String> calls = new ArrayList<>();
        task.attach(t -> {
            throw new IllegalStateException("listener bug");
        });
        task.attach(t -> calls.add("after"));

        task.notifyListeners();

        assertThat(calls).containsExactly("after");
    }

    @Test
    void startTransfersAllBytesAndCompletes() {
        FakeStorageClient client = new FakeStorageClient(16).withObject("a.bin", 100);
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<Long> seen = new CopyOnWriteArrayList<>();
        task.attach(t -> seen.add(t.getBytesTransferred()));

        task.start(client);

        assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.getSize()).hasValue(100);
        assertThat(task.getBytesTransferred()).isEqualTo(100);
        assertThat(task.isTransferComplete()).isTrue();
        assertThat(task.getStartedAt()).isNotNull();
        assertThat(task.getFinishedAt()).isNotNull();
        // 7 chunks plus the final state change
        assertThat(seen).hasSize(8);
        assertThat(seen).isSorted();
        assertThat(seen.get(seen.size() - 1)).isEqualTo(100L);
    }

    @Test
    void zeroByteObjectCompletesWithFinalNotification() {
        FakeStorageClient client = new FakeStorageClient().withObject("empty.txt", 0);
        DownloadTask task = TaskFixtures.readyTask("empty.txt");
        List<TaskState> states = new ArrayList<>();
        task.attach(t -> states.add(t.getState()));

        task.start(client);

        assertThat(states).containsExactly(TaskState.COMPLETED);
        assertThat(task.isTransferComplete()).isTrue();
    }

    @Test
    void probeFailureLeavesSizeUnknownAndStillTransfers() {
        FakeStorageClient client = new FakeStorageClient(16)
                .withObject("a.bin", 40)
                .failProbe("a.bin");
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<Boolean> completeFlags = new ArrayList<>();
        task.attach(t -> completeFlags.add(t.isTransferComplete()));

        task.start(client);

        // No completion can be observed while the size is unknown
        assertThat(completeFlags.subList(0, completeFlags.size() - 1)).containsOnly(false);
        assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.getSize()).hasValue(40);
        assertThat(completeFlags.get(completeFlags.size() - 1)).isTrue();
    }

    @Test
    void missingObjectFailsTheTask() {
        DownloadTask task = TaskFixtures.readyTask("missing.bin");

        task.start(new FakeStorageClient());

        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(task.getSize()).isEmpty();
        assertThat(task.getFailure())
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("missing.bin");
        assertThat(((StorageException) task.getFailure()).getKind()).isEqualTo(StorageException.Kind.TRANSFER);
    }

    @Test
    void interruptedTransferFailsWithPartialBytes() {
        FakeStorageClient client = new FakeStorageClient(16)
                .withObject("a.bin", 128)
                .failTransfer("a.bin");
        DownloadTask task = TaskFixtures.readyTask("a.bin");

        task.start(client);

        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(task.getBytesTransferred()).isBetween(1L, 127L);
        assertThat(task.isTransferComplete()).isFalse();
    }

    @Test
    void progressIsClampedAtKnownSize() {
        DownloadTask sized = TaskFixtures.readyTask("b.bin");
        sized.start(new FakeStorageClient(10).withObject("b.bin", 30));

        TaskFixtures.receive(sized, 25);

        assertThat(sized.getBytesTransferred()).isEqualTo(30);
        assertThat(sized.isTransferComplete()).isTrue();
    }

    @Test
    void nonPositiveProgressIsIgnored() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        List<Long> seen = new ArrayList<>();
        task.attach(t -> seen.add(t.getBytesTransferred()));

        TaskFixtures.receive(task, 0);
        TaskFixtures.receive(task, -5);
        TaskFixtures.receive(task, 7);

        assertThat(seen).containsExactly(7L);
    }

    @Test
    void startIsRejectedUnlessReady() {
        FakeStorageClient client = new FakeStorageClient().withObject("a.bin", 10);
        DownloadTask pending = TaskFixtures.pendingTask("a.bin");

        pending.start(client);

        assertThat(pending.getState()).isEqualTo(TaskState.PENDING);
        assertThat(client.getTransferOrder()).isEmpty();
    }

    @Test
    void completedTaskCannotBeStartedAgain() {
        FakeStorageClient client = new FakeStorageClient().withObject("a.bin", 10);
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.start(client);

        task.start(client);

        assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
        assertThat(client.getTransferOrder()).containsExactly("a.bin");
    }

    @Test
    void markReadyOnlyFromPending() {
        DownloadTask task = TaskFixtures.pendingTask("a.bin");

        assertThat(task.markReady()).isTrue();
        assertThat(task.markReady()).isFalse();
        assertThat(task.getState()).isEqualTo(TaskState.READY);
    }
}
