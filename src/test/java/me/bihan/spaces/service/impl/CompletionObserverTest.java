package me.bihan.spaces.service.impl;

import me.bihan.spaces.service.DownloadTask;
import me.bihan.spaces.service.TaskFixtures;
import me.bihan.spaces.service.TaskState;
import me.bihan.spaces.storage.FakeStorageClient;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionObserverTest {

    @Test
    void firesOnceWhenAllBytesArrive() {
        List<DownloadTask> completed = new ArrayList<>();
        CompletionObserver observer = new CompletionObserver(completed::add);
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.attach(observer);

        task.start(new FakeStorageClient(10).withObject("a.bin", 30));
        task.notifyListeners();
        task.notifyListeners();

        assertThat(completed).containsExactly(task);
    }

    @Test
    void ignoresPartialProgress() {
        List<DownloadTask> completed = new ArrayList<>();
        CompletionObserver observer = new CompletionObserver(completed::add);
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.attach(observer);

        TaskFixtures.receive(task, 10);

        assertThat(completed).isEmpty();
    }

    @Test
    void ignoresFailedTransfers() {
        List<DownloadTask> completed = new ArrayList<>();
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.attach(new CompletionObserver(completed::add));

        task.start(new FakeStorageClient(16).withObject("a.bin", 128).failTransfer("a.bin"));

        assertThat(completed).isEmpty();
    }

    @Test
    void waitsForTheTransferToReturnAfterTheLastChunk() {
        List<DownloadTask> completed = new ArrayList<>();
        List<TaskState> statesWithAllBytes = new ArrayList<>();
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.attach(t -> {
            if (t.isTransferComplete()) {
                statesWithAllBytes.add(t.getState());
            }
        });
        task.attach(new CompletionObserver(completed::add));

        task.start(new FakeStorageClient(10).withObject("a.bin", 30).failAfterLastChunk("a.bin"));

        assertThat(statesWithAllBytes).contains(TaskState.RUNNING);
        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(completed).isEmpty();
    }

    @Test
    void tracksTasksIndependently() {
        List<DownloadTask> completed = new ArrayList<>();
        CompletionObserver observer = new CompletionObserver(completed::add);
        FakeStorageClient storage = new FakeStorageClient().withObject("a", 8).withObject("b", 8);
        DownloadTask a = TaskFixtures.readyTask("a");
        DownloadTask b = TaskFixtures.readyTask("b");
        a.attach(observer);
        b.attach(observer);

        a.start(storage);
        b.start(storage);

        assertThat(completed).containsExactly(a, b);
    }

    @Test
    void worksWithoutCallback() {
        DownloadTask task = TaskFixtures.readyTask("a.bin");
        task.attach(new CompletionObserver());

        task.start(new FakeStorageClient().withObject("a.bin", 4));

        assertThat(task.isTransferComplete()).isTrue();
    }
}
