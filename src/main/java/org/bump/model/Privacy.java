package org.bump.model;

public enum Privacy {
    PUBLIC,   // visible par tout le monde
    FRIENDS,  // visible par les amis acceptés
    PRIVATE   // visible seulement par son auteur
}
