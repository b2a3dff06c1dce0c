package com.example.webhookdispatch.service;

import com.example.webhookdispatch.model.WebhookEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 业务层在提交变更时显式调用的事件入口。
 * 修改实体状态的代码自己传入修改前的状态，由这里决定事件名，不做前后快照比对。
 */
@Service
@RequiredArgsConstructor
public class DomainEventNotifier {

    static final String STATUS = "status";

    private final WebhookDispatcher dispatcher;

    public int applicationCreated(Long ownerId, Map<String, Object> application) {
        return dispatch(WebhookEventType.APPLICATION_CREATED, application, ownerId);
    }

    /**
     * 申请更新：状态变化时发送 application.status_changed（附带 previous_status / new_status），否则发送 application.updated。
     *
     * @param ownerId        所属用户
     * @param previousStatus 修改前的状态
     * @param application    修改后的数据，status 字段为新状态
     */
    public int applicationUpdated(Long ownerId, String previousStatus, Map<String, Object> application) {
        Object newStatus = application.get(STATUS);
        if (!Objects.equals(previousStatus, newStatus)) {
            Map<String, Object> data = new LinkedHashMap<>(application);
            data.put("previous_status", previousStatus);
            data.put("new_status", newStatus);
            return dispatch(WebhookEventType.APPLICATION_STATUS_CHANGED, data, ownerId);
        }
        return dispatch(WebhookEventType.APPLICATION_UPDATED, application, ownerId);
    }

    public int applicationDeleted(Long ownerId, Map<String, Object> application) {
        return dispatch(WebhookEventType.APPLICATION_DELETED, application, ownerId);
    }

    public int interviewCreated(Long ownerId, Map<String, Object> interview) {
        if (ownerId == null) {
            return 0;
        }
        return dispatch(WebhookEventType.INTERVIEW_CREATED, interview, ownerId);
    }

    /**
     * 面试更新：状态变为 completed / cancelled 时发送对应事件，其余情况发送 interview.updated。
     * 面试没有关联到用户（ownerId 为 null）时不分发。
     */
    public int interviewUpdated(Long ownerId, String previousStatus, Map<String, Object> interview) {
        if (ownerId == null) {
            return 0;
        }
        Object newStatus = interview.get(STATUS);
        WebhookEventType type = WebhookEventType.INTERVIEW_UPDATED;
        if (!Objects.equals(previousStatus, newStatus)) {
            if ("completed".equals(newStatus)) {
                type = WebhookEventType.INTERVIEW_COMPLETED;
            } else if ("cancelled".equals(newStatus)) {
                type = WebhookEventType.INTERVIEW_CANCELLED;
            }
        }
        return dispatch(type, interview, ownerId);
    }

    public int companyCreated(Long ownerId, Map<String, Object> company) {
        return dispatch(WebhookEventType.COMPANY_CREATED, company, ownerId);
    }

    private int dispatch(WebhookEventType type, Map<String, Object> data, Long ownerId) {
        return dispatcher.dispatch(type.getValue(), data, ownerId);
    }
}
