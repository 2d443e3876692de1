package org.bump.dto;

import lombok.*;
import org.bump.model.Place;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class PlaceDto {
    private Long id;
    private String name;
    private String address;
    private Double lat;
    private Double lng;

    public static PlaceDto of(Place p) {
        return new PlaceDto(p.getId(), p.getName(), p.getAddress(), p.getLat(), p.getLng());
    }
}
