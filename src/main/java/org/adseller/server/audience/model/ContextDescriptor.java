package org.adseller.server.audience.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ContextDescriptor {

    String url;

    String pageTitle;

    List<String> keywords;

    @Builder.Default
    String language = "en";

    String device;

    String geography;

    List<String> contentCategories;
}
