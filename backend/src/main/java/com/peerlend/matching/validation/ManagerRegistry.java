package com.peerlend.matching.validation;

import com.peerlend.matching.event.ManagerApprovalEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit allow-list of managers per delegator. A manager acts on behalf of a delegator only while approved;
 * nothing is inherited or implied.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManagerRegistry {

    private final Map<String, Set<String>> managersByDelegator = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher applicationEventPublisher;

    public void approveManager(String delegator, String manager, boolean approved) {
        if (approved) {
            managersByDelegator.computeIfAbsent(delegator, d -> ConcurrentHashMap.newKeySet()).add(manager);
        } else {
            managersByDelegator.computeIfPresent(delegator, (d, managers) -> {
                managers.remove(manager);
                return managers.isEmpty() ? null : managers;
            });
        }
        log.info("Manager {} {} for {}", manager, approved ? "approved" : "revoked", delegator);
        applicationEventPublisher.publishEvent(new ManagerApprovalEvent(this, delegator, manager, approved));
    }

    public boolean isManagedBy(String delegator, String manager) {
        Set<String> managers = managersByDelegator.get(delegator);
        return managers != null && managers.contains(manager);
    }
}
