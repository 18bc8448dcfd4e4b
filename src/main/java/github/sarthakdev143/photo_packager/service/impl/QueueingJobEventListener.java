package github.sarthakdev143.photo_packager.service.impl;

import github.sarthakdev143.photo_packager.model.JobEvent;
import github.sarthakdev143.photo_packager.service.JobEventListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Adapts the event stream to a queue so a presentation layer can drain it on its own thread.
 */
public class QueueingJobEventListener implements JobEventListener {

    private final BlockingQueue<JobEvent> queue;

    public QueueingJobEventListener() {
        this(new LinkedBlockingQueue<>());
    }

    public QueueingJobEventListener(BlockingQueue<JobEvent> queue) {
        this.queue = queue;
    }

    @Override
    public void onEvent(JobEvent event) {
        if (!queue.offer(event)) {
            throw new IllegalStateException("Job event queue is full.");
        }
    }

    public JobEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<JobEvent> drain() {
        List<JobEvent> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public BlockingQueue<JobEvent> queue() {
        return queue;
    }
}
