package com.parish.governance.domain.model;

public record Plan(String id, String name) {
}
