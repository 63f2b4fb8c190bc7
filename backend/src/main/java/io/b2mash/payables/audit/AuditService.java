package io.b2mash.payables.audit;

/** Records audit events for document approvals and report lifecycle changes. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is rolled back too.
   */
  void log(AuditEventRecord record);
}
