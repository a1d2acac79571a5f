package com.eventsync.infrastructure.normalization;

import com.eventsync.domain.exception.NormalizationException;
import com.eventsync.domain.model.EventInput;
import com.eventsync.domain.model.OfferInput;
import com.eventsync.domain.model.OrganizationInput;
import com.eventsync.domain.model.PlaceInput;
import com.eventsync.domain.model.RawEvent;
import com.eventsync.domain.model.SourceConfig;
import com.eventsync.domain.model.SourceInput;
import com.eventsync.infrastructure.scraper.jsonld.JsonLdExtractor;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns raw records from either scraping tier into {@link EventInput}s.
 *
 * <p>Name and start date are the only mandatory fields. Values are passed through
 * as found; date formats and end-before-start are left to the ingest API.
 */
public class EventNormalizer {

    private static final String DEFAULT_TYPE = "Event";

    /**
     * Tier 0: a schema.org Event node as returned by {@link JsonLdExtractor}.
     */
    public EventInput normalizeStructured(JsonNode node, SourceConfig source) throws NormalizationException {
        if (node == null || !node.isObject()) {
            throw new NormalizationException("event is not a JSON object");
        }

        String name = JsonLdValue.text(node.get("name"));
        if (name.isEmpty()) {
            throw new NormalizationException("event has no name");
        }
        String startDate = JsonLdValue.date(node.get("startDate"));
        if (startDate.isEmpty()) {
            throw new NormalizationException("event has no startDate");
        }

        String type = JsonLdExtractor.typeOf(node);

        return EventInput.builder()
            .type(type.isEmpty() ? DEFAULT_TYPE : type)
            .name(name)
            .description(emptyToNull(JsonLdValue.text(node.get("description"))))
            .startDate(startDate)
            .endDate(emptyToNull(JsonLdValue.date(node.get("endDate"))))
            .doorTime(emptyToNull(JsonLdValue.date(node.get("doorTime"))))
            .location(parseLocation(node.get("location")))
            .organizer(parseOrganizer(node.get("organizer")))
            .image(emptyToNull(parseImage(node.get("image"))))
            .url(emptyToNull(JsonLdValue.text(node.get("url"))))
            .offers(parseOffer(node.get("offers")))
            .keywords(JsonLdValue.list(node.get("keywords")))
            .inLanguage(JsonLdValue.list(node.get("inLanguage")))
            .isAccessibleForFree(JsonLdValue.bool(node.get("isAccessibleForFree")))
            .sameAs(JsonLdValue.list(node.get("sameAs")))
            .license(source.getLicense())
            .source(sourceInput(source, externalId(node)))
            .build();
    }

    /**
     * Tier 1: text fields scraped with CSS selectors.
     */
    public EventInput normalizeRaw(RawEvent raw, SourceConfig source) throws NormalizationException {
        String name = trim(raw.name());
        if (name.isEmpty()) {
            throw new NormalizationException("raw event has no name");
        }
        String startDate = trim(raw.startDate());
        if (startDate.isEmpty()) {
            throw new NormalizationException("raw event has no startDate");
        }

        String location = trim(raw.location());
        String url = trim(raw.url());
        String eventId = url.isEmpty()
            ? NormalizationUtils.generateScrapedEventId(source.getName(), name, startDate)
            : url;

        return EventInput.builder()
            .name(name)
            .description(emptyToNull(NormalizationUtils.collapseWhitespace(raw.description())))
            .startDate(startDate)
            .endDate(emptyToNull(trim(raw.endDate())))
            .location(location.isEmpty() ? null : PlaceInput.named(location))
            .url(emptyToNull(url))
            .image(emptyToNull(trim(raw.image())))
            .license(source.getLicense())
            .source(sourceInput(source, eventId))
            .build();
    }

    /**
     * Priority: {@code @id}, then {@code identifier}, then {@code url}.
     */
    static String externalId(JsonNode node) {
        String id = JsonLdValue.text(node.get("@id"));
        if (!id.isEmpty()) {
            return id;
        }
        id = JsonLdValue.text(node.get("identifier"));
        if (!id.isEmpty()) {
            return id;
        }
        return JsonLdValue.text(node.get("url"));
    }

    static PlaceInput parseLocation(JsonNode value) {
        JsonNode node = JsonLdValue.first(value);
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            String name = node.asText().trim();
            return name.isEmpty() ? null : PlaceInput.named(name);
        }
        if (!node.isObject()) {
            return null;
        }

        String id = JsonLdValue.text(node.get("@id"));
        String name = JsonLdValue.text(node.get("name"));

        String street = "";
        String locality = "";
        String region = "";
        String postalCode = "";
        String country = "";

        JsonNode address = JsonLdValue.first(node.get("address"));
        if (address != null && address.isObject()) {
            street = JsonLdValue.text(address.get("streetAddress"));
            locality = JsonLdValue.text(address.get("addressLocality"));
            region = JsonLdValue.text(address.get("addressRegion"));
            postalCode = JsonLdValue.text(address.get("postalCode"));
            country = addressCountry(address.get("addressCountry"));
        } else if (address != null && address.isTextual()) {
            street = address.asText().trim();
        }

        // Flat fields only fill what the nested address left empty
        if (street.isEmpty()) {
            street = JsonLdValue.text(node.get("streetAddress"));
        }
        if (locality.isEmpty()) {
            locality = JsonLdValue.text(node.get("addressLocality"));
        }
        if (region.isEmpty()) {
            region = JsonLdValue.text(node.get("addressRegion"));
        }
        if (postalCode.isEmpty()) {
            postalCode = JsonLdValue.text(node.get("postalCode"));
        }
        if (country.isEmpty()) {
            country = addressCountry(node.get("addressCountry"));
        }

        Double latitude = null;
        Double longitude = null;
        JsonNode geo = JsonLdValue.first(node.get("geo"));
        if (geo != null && geo.isObject()) {
            latitude = JsonLdValue.number(geo.get("latitude"));
            longitude = JsonLdValue.number(geo.get("longitude"));
        }

        if (name.isEmpty() && street.isEmpty() && locality.isEmpty() && id.isEmpty()) {
            return null;
        }
        return new PlaceInput(emptyToNull(id), emptyToNull(name), emptyToNull(street), emptyToNull(locality),
            emptyToNull(region), emptyToNull(postalCode), emptyToNull(country), latitude, longitude);
    }

    // addressCountry is either text or a Country object with a name
    private static String addressCountry(JsonNode node) {
        if (node != null && node.isObject() && !node.has("@value")) {
            return JsonLdValue.text(node.get("name"));
        }
        return JsonLdValue.text(node);
    }

    static OrganizationInput parseOrganizer(JsonNode value) {
        JsonNode node = JsonLdValue.first(value);
        if (node == null || !node.isObject()) {
            return null;
        }
        String id = JsonLdValue.text(node.get("@id"));
        String name = JsonLdValue.text(node.get("name"));
        String url = JsonLdValue.text(node.get("url"));
        if (id.isEmpty() && name.isEmpty() && url.isEmpty()) {
            return null;
        }
        return new OrganizationInput(emptyToNull(id), emptyToNull(name), emptyToNull(url),
            emptyToNull(JsonLdValue.text(node.get("email"))),
            emptyToNull(JsonLdValue.text(node.get("telephone"))));
    }

    static OfferInput parseOffer(JsonNode value) {
        JsonNode node = JsonLdValue.first(value);
        if (node == null || !node.isObject()) {
            return null;
        }
        String price = JsonLdValue.text(node.get("price"));
        String currency = JsonLdValue.text(node.get("priceCurrency"));
        String url = JsonLdValue.text(node.get("url"));
        if (price.isEmpty() && currency.isEmpty() && url.isEmpty()) {
            return null;
        }
        return new OfferInput(emptyToNull(url), emptyToNull(price), emptyToNull(currency));
    }

    /**
     * Plain URL, or an ImageObject's {@code url} with {@code contentUrl} as fallback.
     */
    static String parseImage(JsonNode value) {
        JsonNode node = JsonLdValue.first(value);
        if (node == null) {
            return "";
        }
        if (node.isObject() && !node.has("@value")) {
            String url = JsonLdValue.text(node.get("url"));
            return url.isEmpty() ? JsonLdValue.text(node.get("contentUrl")) : url;
        }
        return JsonLdValue.text(node);
    }

    private static SourceInput sourceInput(SourceConfig source, String eventId) {
        return new SourceInput(source.getUrl(), emptyToNull(eventId), source.getName(), source.getLicense());
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
