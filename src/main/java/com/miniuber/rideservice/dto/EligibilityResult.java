package com.miniuber.rideservice.dto;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class EligibilityResult {

    private static final EligibilityResult ELIGIBLE = new EligibilityResult(true, EligibilityReason.ELIGIBLE);

    private final boolean eligible;
    private final EligibilityReason reason;

    public static EligibilityResult eligible() {
        return ELIGIBLE;
    }

    public static EligibilityResult rejected(EligibilityReason reason) {
        return new EligibilityResult(false, reason);
    }
}
