package io.b2mash.ismsp.exception;

import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for every failure the core reports to its callers. Each subclass fixes one {@link
 * ErrorKind}; the problem body carries the kind so HTTP callers can branch on it.
 */
public abstract class IsmsException extends ErrorResponseException {

  private final ErrorKind kind;

  protected IsmsException(ErrorKind kind, String title, String detail, Throwable cause) {
    super(kind.status(), createProblem(kind, title, detail), cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getDetail() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(ErrorKind kind, String title, String detail) {
    var problem = ProblemDetail.forStatus(kind.status());
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("kind", kind.name());
    return problem;
  }
}
