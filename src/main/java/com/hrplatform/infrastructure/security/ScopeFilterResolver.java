package com.hrplatform.infrastructure.security;

import com.hrplatform.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Turns a caller's data scope into the row filter the data layer must apply.
 *
 * <p>Pure function of its inputs. Every resource kind is scoped through the owning employee
 * (department or identity), matching how leave and attendance rows reference employees.
 */
@Component
@Slf4j
public class ScopeFilterResolver {

    public ScopeFilter resolve(AccessContext context, ResourceKind resourceKind) {
        Objects.requireNonNull(context, "Access context must not be null");
        Objects.requireNonNull(resourceKind, "Resource kind must not be null");

        switch (context.getDataScope()) {
            case ALL:
                return ScopeFilter.none();

            case DEPARTMENT:
                if (context.getDepartmentId() == null || context.getDepartmentId().isBlank()) {
                    log.error("User {} has department scope but no department; refusing to scope {}",
                        context.getUserId(), resourceKind);
                    throw new ConfigurationException("Department scope requires a department assignment");
                }
                return new ScopeFilter.DepartmentFilter(context.getDepartmentId());

            case SELF:
                if (context.getOwnerIdentity() == null || context.getOwnerIdentity().isBlank()) {
                    log.error("User {} has self scope but no linked employee; refusing to scope {}",
                        context.getUserId(), resourceKind);
                    throw new ConfigurationException("Self scope requires a linked employee record");
                }
                return new ScopeFilter.SelfFilter(context.getOwnerIdentity());

            default:
                throw new ConfigurationException("Unsupported data scope: " + context.getDataScope());
        }
    }
}
