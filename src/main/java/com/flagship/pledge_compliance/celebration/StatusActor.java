package com.flagship.pledge_compliance.celebration;

import lombok.Value;

/**
 * Who is driving a status change, as recorded in the ledger.
 */
@Value
public class StatusActor {
    TriggerType type;
    String id;
    String name;
    AuditTrail auditTrail;

    public static StatusActor system(String name) {
        return new StatusActor(TriggerType.SYSTEM, null, name, AuditTrail.EMPTY);
    }

    public static StatusActor user(String id, String name, AuditTrail auditTrail) {
        return new StatusActor(TriggerType.USER_ACTION, id, name, auditTrail != null ? auditTrail : AuditTrail.EMPTY);
    }

    public static StatusActor congressionalSession() {
        return new StatusActor(TriggerType.CONGRESSIONAL_SESSION, null, "Congressional Session End", AuditTrail.EMPTY);
    }
}
