package com.peerlend.matching.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class ManagerApprovalEvent extends ApplicationEvent {

    private final String delegator;
    private final String manager;
    private final boolean approved;

    public ManagerApprovalEvent(Object source, String delegator, String manager, boolean approved) {
        super(source);
        this.delegator = delegator;
        this.manager = manager;
        this.approved = approved;
    }
}
