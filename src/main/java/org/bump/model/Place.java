package org.bump.model;

import jakarta.persistence.*;
import lombok.*;

// Lieu géré par le service des lieux, référencé ici uniquement par son id
@Entity
@Table(name = "place")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Place {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String address;
    private Double lat;
    private Double lng;
}
