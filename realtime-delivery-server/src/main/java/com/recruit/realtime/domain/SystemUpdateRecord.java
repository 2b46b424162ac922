package com.recruit.realtime.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "system_updates", indexes = {
    @Index(name = "idx_system_update_user_id", columnList = "userId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemUpdateRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String userId;

    @Column(length = 20)
    private String severity;

    private String title;

    @Column(columnDefinition = "TEXT")
    private String content;

    private boolean actionRequired;

    private Instant createdAt;
}
