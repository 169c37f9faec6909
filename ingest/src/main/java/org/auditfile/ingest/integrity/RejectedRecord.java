package org.auditfile.ingest.integrity;

import org.auditfile.ingest.sink.EntityKind;

/**
 * A record left out of its table because a field it cannot exist without was missing.
 */
public final class RejectedRecord {
  private final EntityKind entity;
  private final String voucherId;
  private final String recordId;
  private final String reason;

  /**
   * Create rejection.
   * @param entity table the record was meant for
   * @param voucherId owning voucher id; empty if none
   * @param recordId record id; empty if none
   * @param reason why it was rejected
   */
  public RejectedRecord(EntityKind entity, String voucherId, String recordId, String reason) {
    this.entity = entity;
    this.voucherId = voucherId;
    this.recordId = recordId;
    this.reason = reason;
  }

  public EntityKind getEntity() {
    return entity;
  }

  public String getVoucherId() {
    return voucherId;
  }

  public String getRecordId() {
    return recordId;
  }

  public String getReason() {
    return reason;
  }
}
