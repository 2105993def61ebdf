package com.example.realty.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tenant")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Tenant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /** channel the admin alerts go out on */
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    @Builder.Default
    private Channel adminChannel = Channel.TELEGRAM;

    /** null means alerts are suppressed */
    private String adminAddress;

    @Enumerated(EnumType.STRING)
    @Column(length = 5)
    @Builder.Default
    private Language defaultLanguage = Language.EN;

    @Builder.Default
    private boolean active = true;
}
