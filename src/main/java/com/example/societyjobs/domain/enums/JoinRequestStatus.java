package com.example.societyjobs.domain.enums;

public enum JoinRequestStatus {
    PENDING,
    APPROVED,
    REJECTED
}
