package org.bump.dto;

import lombok.*;
import org.bump.model.CheckIn;
import org.bump.model.Privacy;

import java.time.Instant;

// Check-in hydraté avec son lieu et le profil de son auteur
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CheckInView {
    private Long id;
    private Long subjectId;
    private Long placeId;
    private String activity;
    private Privacy privacy;
    private Instant createdAt;
    private Instant expiresAt;
    private PlaceDto place;
    private ProfileSummary subject;

    public static CheckInView of(CheckIn c, PlaceDto place, ProfileSummary subject) {
        return CheckInView.builder()
                .id(c.getId())
                .subjectId(c.getSubjectId())
                .placeId(c.getPlaceId())
                .activity(c.getActivity())
                .privacy(c.getPrivacy())
                .createdAt(c.getCreatedAt())
                .expiresAt(c.getExpiresAt())
                .place(place)
                .subject(subject)
                .build();
    }
}
