package com.fw24.framework.audit;

public class NoopAuditor implements EntityAuditor {

    @Override
    public void audit(AuditRecord record) {
        // intentionally empty
    }
}
