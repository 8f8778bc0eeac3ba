package com.autoposter.engine.repository;

import com.autoposter.engine.model.JobStatus;

public interface JobStatusCount {
    JobStatus getStatus();

    long getTotal();
}
