package org.bump.model;

/**
 * Vue typée de l'état d'une relation. La direction n'a de sens que tant que la demande est en attente.
 */
public interface RelationshipState {

    boolean involves(Long userId);

    record Pending(Long from, Long to) implements RelationshipState {
        @Override
        public boolean involves(Long userId) {
            return from.equals(userId) || to.equals(userId);
        }
    }

    record Accepted(Long a, Long b) implements RelationshipState {
        @Override
        public boolean involves(Long userId) {
            return a.equals(userId) || b.equals(userId);
        }
    }

    // Héritage de l'ancien schéma : plus produit par aucune opération
    record Rejected(Long from, Long to) implements RelationshipState {
        @Override
        public boolean involves(Long userId) {
            return from.equals(userId) || to.equals(userId);
        }
    }
}
