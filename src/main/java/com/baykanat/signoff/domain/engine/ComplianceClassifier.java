package com.baykanat.signoff.domain.engine;

import com.baykanat.signoff.domain.model.QualificationStatus;
import com.baykanat.signoff.domain.model.RiskBucket;
import com.baykanat.signoff.domain.model.SignoffEvent;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/** Çözülmüş event'i ve geçen gün sayısını uyumluluk durumuna ve risk kovasına çevirir. */
public class ComplianceClassifier {

    public static final long OVERDUE_AFTER_DAYS = 90;
    public static final long LOW_RISK_MAX_DAYS = 60;
    public static final long MEDIUM_RISK_MAX_DAYS = 90;

    private final LatestSignoffResolver resolver;

    public ComplianceClassifier(LatestSignoffResolver resolver) {
        this.resolver = resolver;
    }

    /** Event günü ile as-of günü arasındaki takvim günü sınırı sayısı; saat kısmı dikkate alınmaz. */
    public static long elapsedDays(LocalDateTime eventTimestamp, LocalDateTime asOf) {
        return ChronoUnit.DAYS.between(eventTimestamp.toLocalDate(), asOf.toLocalDate());
    }

    /** 90 günü aşan her event metodundan bağımsız olarak overdue sayılır. */
    public QualificationStatus qualify(SignoffEvent latest, long elapsedDays) {
        if (elapsedDays > OVERDUE_AFTER_DAYS) {
            return QualificationStatus.SIGN_OFF_OVERDUE;
        }
        return resolver.isDeferred(latest)
                ? QualificationStatus.DEFERRED_SIGNED_OFF
                : QualificationStatus.SIGNED_OFF;
    }

    /**
     * İlk eşleşen kazanır: 0..60 düşük, 60..90 orta, 90 üstü yüksek; tam 60 gün düşük kovadadır.
     * Negatif değer (gelecek tarihli event) hiçbir kovaya girmez.
     */
    public Optional<RiskBucket> riskBucket(long elapsedDays) {
        if (elapsedDays >= 0 && elapsedDays <= LOW_RISK_MAX_DAYS) {
            return Optional.of(RiskBucket.LOW);
        }
        if (elapsedDays >= LOW_RISK_MAX_DAYS && elapsedDays <= MEDIUM_RISK_MAX_DAYS) {
            return Optional.of(RiskBucket.MEDIUM);
        }
        if (elapsedDays > MEDIUM_RISK_MAX_DAYS) {
            return Optional.of(RiskBucket.HIGH);
        }
        return Optional.empty();
    }
}
