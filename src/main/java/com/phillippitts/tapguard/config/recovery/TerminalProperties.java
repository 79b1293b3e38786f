package com.phillippitts.tapguard.config.recovery;

import com.phillippitts.tapguard.domain.TerminalLayout;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties describing the terminal this instance guards (prefix {@code terminal}).
 */
@Validated
@ConfigurationProperties(prefix = "terminal")
public class TerminalProperties {

    /** Configured layout; the bridge may override it per signal push. */
    @NotNull
    private final TerminalLayout layout;

    /** Device type passed to start-discovery. */
    @NotBlank
    private final String deviceTypeFilter;

    /** Preset used when zero-touch transactions are recreated automatically. */
    @Valid
    private final TapToPay tapToPay;

    @ConstructorBinding
    public TerminalProperties(TerminalLayout layout, String deviceTypeFilter, TapToPay tapToPay) {
        this.layout = layout == null ? TerminalLayout.MANUAL : layout;
        this.deviceTypeFilter = (deviceTypeFilter == null || deviceTypeFilter.isBlank())
                ? "INTERNAL"
                : deviceTypeFilter;
        this.tapToPay = tapToPay == null ? new TapToPay(null, null, null) : tapToPay;
    }

    public static TerminalProperties of(TerminalLayout layout) {
        return new TerminalProperties(layout, null, null);
    }

    public TerminalLayout getLayout() { return layout; }
    public String getDeviceTypeFilter() { return deviceTypeFilter; }
    public TapToPay getTapToPay() { return tapToPay; }

    /**
     * Zero-touch sale preset.
     *
     * @param amount   amount in minor currency units
     * @param currency ISO currency code
     * @param category merchant category label
     */
    public record TapToPay(@Positive Long amount, @NotBlank String currency, @NotBlank String category) {
        public TapToPay {
            amount = amount == null ? 100L : amount;
            currency = currency == null ? "usd" : currency;
            category = category == null ? "general" : category;
        }
    }
}
