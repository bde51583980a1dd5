package com.fw24.framework.audit;

public interface EntityAuditor {
    void audit(AuditRecord record);
}
