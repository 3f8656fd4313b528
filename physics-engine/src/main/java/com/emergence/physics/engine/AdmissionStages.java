package com.emergence.physics.engine;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.validation.AdmissionCheck;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Orders admission checks by their {@link AdmissionStage} metadata. Every check must be annotated,
 * names and orders must be unique, and all non-locking stages must come before the locking ones
 * (the pipeline takes ledger locks once, between the two groups).
 */
public final class AdmissionStages {

    private AdmissionStages() {
    }

    /**
     * @throws IllegalArgumentException when a check is not annotated or the metadata is inconsistent
     */
    public static List<Stage> order(List<? extends AdmissionCheck> checks) {
        List<Stage> stages = new ArrayList<>();
        Set<String> names = new HashSet<>();
        Set<Integer> orders = new HashSet<>();
        for (AdmissionCheck check : Objects.requireNonNull(checks, "checks")) {
            Class<?> clazz = Objects.requireNonNull(check, "check").getClass();
            AdmissionStage ann = clazz.getAnnotation(AdmissionStage.class);
            if (ann == null) {
                throw new IllegalArgumentException("Admission check must be annotated with @AdmissionStage: " + clazz.getName());
            }
            String name = ann.name() != null ? ann.name().trim() : "";
            if (name.isEmpty()) {
                throw new IllegalArgumentException("@AdmissionStage name must be non-blank: " + clazz.getName());
            }
            if (!names.add(name)) {
                throw new IllegalArgumentException("Admission stage already registered: " + name);
            }
            if (!orders.add(ann.order())) {
                throw new IllegalArgumentException("Admission stage order " + ann.order() + " used twice (" + name + ")");
            }
            stages.add(new Stage(name, ann.order(), ann.locking(), check));
        }
        stages.sort(Comparator.comparingInt(Stage::getOrder));
        boolean seenLocking = false;
        for (Stage stage : stages) {
            if (stage.isLocking()) {
                seenLocking = true;
            } else if (seenLocking) {
                throw new IllegalArgumentException("Non-locking stage " + stage.getName() + " is ordered after a locking stage");
            }
        }
        return List.copyOf(stages);
    }

    /** An admission check with its stage metadata. */
    public static final class Stage {
        private final String name;
        private final int order;
        private final boolean locking;
        private final AdmissionCheck check;

        private Stage(String name, int order, boolean locking, AdmissionCheck check) {
            this.name = name;
            this.order = order;
            this.locking = locking;
            this.check = check;
        }

        public String getName() {
            return name;
        }

        public int getOrder() {
            return order;
        }

        public boolean isLocking() {
            return locking;
        }

        public AdmissionCheck getCheck() {
            return check;
        }

        @Override
        public String toString() {
            return name + "#" + order + (locking ? "" : " (lock-free)");
        }
    }
}
