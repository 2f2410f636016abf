package com.novelvision.visualization.orchestrator;

import com.novelvision.visualization.exception.ForbiddenException;
import com.novelvision.visualization.exception.ValidationException;
import com.novelvision.visualization.jobs.VisualizationJob;

/** Identity of whoever invokes an operation that needs ownership. */
public record Caller(String userId, boolean admin) {

  public Caller {
    if (userId == null || userId.isBlank()) {
      throw new ValidationException("userId is required");
    }
  }

  public static Caller user(String userId) {
    return new Caller(userId, false);
  }

  public static Caller admin(String userId) {
    return new Caller(userId, true);
  }

  /** @throws ForbiddenException unless this caller owns {@code job} or is an administrator */
  public void checkAccess(VisualizationJob job, String operation) {
    if (!admin && !job.isOwnedBy(userId)) {
      throw new ForbiddenException(
              "User " + userId + " may not " + operation + " job " + job.id())
          .withContext("jobId", job.id());
    }
  }
}
