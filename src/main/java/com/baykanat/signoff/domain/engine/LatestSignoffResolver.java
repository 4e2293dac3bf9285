package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.SignoffEvent;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bir kontratın silinmemiş event'leri içinden "son" event'i seçer. Üç politika:
 * <ul>
 *   <li>A: deferred olmayanlar arasında en yeni, eşitlikte büyük user id; tüm event'ler bayrakla döner</li>
 *   <li>B: tüm metodlar arasında max zaman damgasına sahip event'lerin hepsi (eşitlik fan-out yapar)</li>
 *   <li>C: deferred olmayanlar arasında max zaman damgası</li>
 * </ul>
 * Girdi listelerinin zaten silinmemiş event'ler olduğu varsayılır.
 */
public class LatestSignoffResolver {

    static final Comparator<SignoffEvent> LATEST_FIRST = Comparator
            .comparing(SignoffEvent::getCreateDtm)
            .thenComparing(SignoffEvent::getDcUserId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .reversed();

    private final int deferredMethodId;

    public LatestSignoffResolver(int deferredMethodId) {
        this.deferredMethodId = deferredMethodId;
    }

    public boolean isDeferred(SignoffEvent event) {
        return event.getSignoffMethodId() != null && event.getSignoffMethodId() == deferredMethodId;
    }

    /** Politika A kazananı: deferred olmayan event'lerde (zaman desc, user id desc) sıralamasında ilk olan. */
    public Optional<SignoffEvent> lastQualifying(Collection<SignoffEvent> events) {
        return events.stream()
                .filter(event -> event.getCreateDtm() != null)
                .filter(event -> !isDeferred(event))
                .min(LATEST_FIRST);
    }

    /**
     * Politika A bayrağı: event kazananla aynı (kontrat, zaman, user id) üçlüsüne sahipse true.
     * Aynı üçlüyü paylaşan birden fazla event'in hepsi true olur.
     */
    public boolean matchesWinner(SignoffEvent event, Optional<SignoffEvent> winner) {
        return winner.filter(w -> Objects.equals(w.getBookingContract(), event.getBookingContract())
                        && Objects.equals(w.getCreateDtm(), event.getCreateDtm())
                        && Objects.equals(w.getDcUserId(), event.getDcUserId()))
                .isPresent();
    }

    /** Politika B: metod fark etmeksizin max zaman damgasını taşıyan tüm event'ler; eşitlikler kırılmaz. */
    public List<SignoffEvent> latestAnyMethod(Collection<SignoffEvent> events) {
        Optional<LocalDateTime> max = events.stream()
                .map(SignoffEvent::getCreateDtm)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
        return max.map(ts -> events.stream()
                        .filter(event -> ts.equals(event.getCreateDtm()))
                        .toList())
                .orElse(List.of());
    }

    /** Politika C: deferred olmayan event'lerin max zaman damgası. */
    public Optional<LocalDateTime> latestNonDeferredTimestamp(Collection<SignoffEvent> events) {
        return events.stream()
                .filter(event -> !isDeferred(event))
                .map(SignoffEvent::getCreateDtm)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }
}
