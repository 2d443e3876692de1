package org.bump.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class PlaceCheckIns {
    private PlaceDto place;
    private List<CheckInView> checkIns = new ArrayList<>();
}
