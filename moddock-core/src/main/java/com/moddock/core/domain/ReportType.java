package com.moddock.core.domain;

import jakarta.persistence.*;

/**
 * Report type catalog entry ("spam", "copyright", ...).
 * Seeded by migration; read-only at runtime.
 */
@Entity
@Table(name = "report_types")
public class ReportType {

    @Id
    private Integer id;

    @Column(nullable = false, unique = true, length = 64)
    private String name;

    protected ReportType() {}

    public Integer getId() { return id; }
    public String getName() { return name; }
}
