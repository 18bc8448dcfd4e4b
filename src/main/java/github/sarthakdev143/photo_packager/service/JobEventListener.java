package github.sarthakdev143.photo_packager.service;

import github.sarthakdev143.photo_packager.model.JobEvent;

@FunctionalInterface
public interface JobEventListener {

    JobEventListener NONE = event -> {
    };

    void onEvent(JobEvent event);
}
