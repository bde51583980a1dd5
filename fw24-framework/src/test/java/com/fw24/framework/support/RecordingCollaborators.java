package com.fw24.framework.support;

import com.fw24.framework.audit.AuditRecord;
import com.fw24.framework.audit.EntityAuditor;
import com.fw24.framework.authorize.AuthorizationRequest;
import com.fw24.framework.authorize.AuthorizationResult;
import com.fw24.framework.authorize.EntityAuthorizer;
import com.fw24.framework.model.validation.ValidationResult;
import com.fw24.framework.validation.EntityValidator;
import com.fw24.framework.validation.SchemaRuleValidator;
import com.fw24.framework.validation.ValidationRequest;

import java.util.ArrayList;
import java.util.List;

public final class RecordingCollaborators {

    private RecordingCollaborators() {
    }

    public static class Validator implements EntityValidator {
        private final EntityValidator delegate = new SchemaRuleValidator();
        public final List<ValidationRequest> requests = new ArrayList<>();

        @Override
        public ValidationResult validateEntity(ValidationRequest request) {
            requests.add(request);
            return delegate.validateEntity(request);
        }
    }

    public static class Authorizer implements EntityAuthorizer {
        public final List<AuthorizationRequest> requests = new ArrayList<>();
        private AuthorizationResult result = AuthorizationResult.allow();

        public void deny(String... reasons) {
            result = AuthorizationResult.deny(reasons);
        }

        @Override
        public AuthorizationResult authorize(AuthorizationRequest request) {
            requests.add(request);
            return result;
        }
    }

    public static class Auditor implements EntityAuditor {
        public final List<AuditRecord> records = new ArrayList<>();

        @Override
        public void audit(AuditRecord record) {
            records.add(record);
        }
    }
}
