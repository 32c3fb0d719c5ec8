package com.bluequee.tabconfig.domain;

/** Requested new {@code displayOrder} for record {@code id}. */
public record OrderChange(long id, int displayOrder) {}
