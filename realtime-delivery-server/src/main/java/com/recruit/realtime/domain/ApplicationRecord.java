package com.recruit.realtime.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "applications", indexes = {
    @Index(name = "idx_application_user_id", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String userId;

    @Column(nullable = false, length = 100)
    private String jobId;

    @Column(nullable = false, length = 30)
    private String status;

    private Double score;

    @Column(columnDefinition = "TEXT")
    private String feedback;

    private Instant updatedAt;
}
