package com.chatflow.realtime.model;

public enum MemberRole {
    OWNER,
    ADMIN,
    MEMBER;

    /** Owners and admins may delete other members' messages, pin messages and manage members. */
    public boolean isAdmin() {
        return this != MEMBER;
    }
}
