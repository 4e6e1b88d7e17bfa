package com.inkwell.common.exception;

/**
 * 请求的实体不存在
 */
public class EntityNotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public EntityNotFoundException(String entityType, Object entityId) {
        super(entityType + " 不存在: " + entityId);
        this.entityType = entityType;
        this.entityId = String.valueOf(entityId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getCode() {
        return "NOT_FOUND";
    }
}
