package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Entity representing a Rider (the customer requesting rides)
 */
@Entity
@Table(name = "riders")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Rider {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    // Home coordinate
    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;
}
