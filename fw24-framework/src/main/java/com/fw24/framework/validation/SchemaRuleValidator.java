package com.fw24.framework.validation;

import com.fw24.framework.model.event.CrudOperation;
import com.fw24.framework.model.validation.ValidationResult;
import com.fw24.framework.model.validation.ValidationRule;
import com.fw24.framework.model.validation.ValidationViolation;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.text.StringSubstitutor;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates the declarative rules returned by an entity service against the operation
 * input. All failures are collected.
 * <p>
 * Rules without an explicit operation list only apply to writes. On update a
 * {@code required} attribute that is absent from the patch is not reported.
 */
@ApplicationScoped
public class SchemaRuleValidator implements EntityValidator {

    private static final Logger LOG = Logger.getLogger(SchemaRuleValidator.class);

    @Override
    public ValidationResult validateEntity(ValidationRequest request) {
        CrudOperation operation = request.getOperationName();
        Map<String, Object> input = request.getInput() == null ? Map.of() : request.getInput();
        List<ValidationViolation> violations = new ArrayList<>();

        for (Map.Entry<String, List<ValidationRule>> entry : request.getEntityValidations().entrySet()) {
            String attribute = entry.getKey();
            Object received = input.get(attribute);
            for (ValidationRule rule : entry.getValue()) {
                boolean applies = rule.getOperations().isEmpty() ? operation != null && operation.isWrite() : rule.appliesTo(operation);
                if (!applies) {
                    continue;
                }
                if (operation == CrudOperation.UPDATE && "required".equals(rule.getName()) && !input.containsKey(attribute)) {
                    continue;
                }
                Object refined = refine(rule.getName(), received);
                Boolean pass = test(rule, received, refined);
                if (pass == null) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debugf("Skipping unknown validation rule %s on %s.%s", rule.getName(), request.getEntityName(), attribute);
                    }
                    continue;
                }
                if (!pass) {
                    violations.add(violation(request, attribute, rule, received, refined));
                }
            }
        }
        return violations.isEmpty() ? ValidationResult.passed() : ValidationResult.failed(violations);
    }

    /**
     * @return the outcome, or {@code null} when the rule is not known
     */
    private Boolean test(ValidationRule rule, Object received, Object refined) {
        Object expected = rule.getValue();
        if ("required".equals(rule.getName())) {
            return !Boolean.TRUE.equals(expected) || isPresent(received);
        }
        if (received == null) {
            return switch (rule.getName()) {
                case "minLength", "maxLength", "pattern", "inList", "notInList", "eq", "neq", "gt", "gte", "lt", "lte" -> true;
                default -> null;
            };
        }
        return switch (rule.getName()) {
            case "minLength" -> refined instanceof Integer length && length >= toNumber(expected).intValue();
            case "maxLength" -> refined instanceof Integer length && length <= toNumber(expected).intValue();
            case "pattern" -> Pattern.compile(String.valueOf(expected)).matcher(String.valueOf(received)).matches();
            case "inList" -> expected instanceof Collection<?> list && list.contains(received);
            case "notInList" -> !(expected instanceof Collection<?> list) || !list.contains(received);
            case "eq" -> compare(received, expected) == 0;
            case "neq" -> compare(received, expected) != 0;
            case "gt" -> compare(received, expected) > 0;
            case "gte" -> compare(received, expected) >= 0;
            case "lt" -> compare(received, expected) < 0;
            case "lte" -> compare(received, expected) <= 0;
            default -> null;
        };
    }

    private static Object refine(String ruleName, Object received) {
        if (!"minLength".equals(ruleName) && !"maxLength".equals(ruleName)) {
            return received;
        }
        if (received instanceof CharSequence text) {
            return text.length();
        }
        if (received instanceof Collection<?> collection) {
            return collection.size();
        }
        if (received instanceof Map<?, ?> map) {
            return map.size();
        }
        return null;
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof CharSequence text) || !text.toString().isBlank();
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number number) {
            return number;
        }
        return Double.parseDouble(String.valueOf(value));
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object received, Object expected) {
        if (received instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (received instanceof Comparable comparable && expected != null && received.getClass().isInstance(expected)) {
            return comparable.compareTo(expected);
        }
        return String.valueOf(received).compareTo(String.valueOf(expected));
    }

    private ValidationViolation violation(ValidationRequest request, String attribute, ValidationRule rule,
                                          Object received, Object refined) {
        String ruleId = rule.getName().toLowerCase(Locale.ROOT);
        List<String> messageIds = new ArrayList<>();
        if (rule.getMessageId() != null) {
            messageIds.add(rule.getMessageId());
        }
        messageIds.add(ValidationMessages.PREFIX + request.getEntityName() + "." + attribute + "." + ruleId);
        messageIds.add(ValidationMessages.PREFIX + ruleId);

        String template = rule.getMessage();
        for (int i = 0; template == null && i < messageIds.size(); i++) {
            template = request.getOverriddenErrorMessages().get(messageIds.get(i));
        }
        for (int i = 0; template == null && i < messageIds.size(); i++) {
            template = ValidationMessages.DEFAULTS.get(messageIds.get(i));
        }
        if (template == null) {
            template = ValidationMessages.DEFAULTS.get(ValidationMessages.FALLBACK_ID);
        }

        Map<String, Object> values = new HashMap<>();
        values.put("key", attribute);
        values.put("validationName", rule.getName());
        values.put("validationValue", rule.getValue());
        values.put("received", received);
        values.put("refinedReceived", refined);
        String message = new StringSubstitutor(values, "{", "}").replace(template);

        ValidationViolation violation = new ValidationViolation(attribute, message, received);
        violation.setMessageIds(messageIds);
        return violation;
    }
}
