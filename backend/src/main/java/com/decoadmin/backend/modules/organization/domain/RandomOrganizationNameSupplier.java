package com.decoadmin.backend.modules.organization.domain;

import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * "Magic Unicorn", "Cosmic Dragon", ... Used when the user picks "Create new admin"
 * without typing a name; the setup dialog lets them rename it right after.
 */
public class RandomOrganizationNameSupplier implements OrganizationNameSupplier {

    static final List<String> ADJECTIVES = List.of(
            "Magic", "Cosmic", "Happy", "Swift", "Bright", "Golden",
            "Silver", "Crystal", "Mystic", "Noble", "Rapid", "Stellar",
            "Lucky", "Mighty", "Clever", "Bold", "Wild", "Cool",
            "Epic", "Super", "Mega", "Ultra", "Turbo", "Hyper"
    );

    static final List<String> NOUNS = List.of(
            "Unicorn", "Dragon", "Phoenix", "Tiger", "Eagle", "Wolf",
            "Falcon", "Lion", "Panther", "Raven", "Hawk", "Bear",
            "Fox", "Owl", "Shark", "Dolphin", "Penguin", "Koala",
            "Panda", "Otter", "Rabbit", "Squirrel", "Raccoon", "Beaver"
    );

    private final RandomGenerator random;

    public RandomOrganizationNameSupplier(RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String get() {
        String adjective = ADJECTIVES.get(random.nextInt(ADJECTIVES.size()));
        String noun = NOUNS.get(random.nextInt(NOUNS.size()));
        return adjective + " " + noun;
    }
}
