package com.docuvision.pipeline.service.manifest;

import java.util.List;
import java.util.Optional;

public sealed interface ManifestShape
        permits ManifestShape.TedRelease, ManifestShape.BeschaLinks, ManifestShape.Unrecognized {

    List<String> documentUrls();

    String label();

    /**
     * Open contracting release package published by TED; every tender document is fetched.
     */
    record TedRelease(List<String> documents) implements ManifestShape {

        public TedRelease {
            documents = documents == null ? List.of() : List.copyOf(documents);
        }

        @Override
        public List<String> documentUrls() {
            return documents;
        }

        @Override
        public String label() {
            return "ted-release";
        }
    }

    /**
     * BeschA notice; only the German PDF rendition is fetched.
     */
    record BeschaLinks(Optional<String> germanUrl) implements ManifestShape {

        public BeschaLinks {
            germanUrl = germanUrl == null ? Optional.empty() : germanUrl;
        }

        @Override
        public List<String> documentUrls() {
            return germanUrl.map(List::of).orElse(List.of());
        }

        @Override
        public String label() {
            return "bescha-links";
        }
    }

    record Unrecognized() implements ManifestShape {

        @Override
        public List<String> documentUrls() {
            return List.of();
        }

        @Override
        public String label() {
            return "unrecognized";
        }
    }
}
