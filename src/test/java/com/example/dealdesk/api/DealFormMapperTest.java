package com.example.dealdesk.api;

import com.example.dealdesk.api.dto.DealDtos.AccessoryLine;
import com.example.dealdesk.api.dto.DealDtos.DealForm;
import com.example.dealdesk.config.DealDeskProperties;
import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.PaymentFrequency;
import com.example.dealdesk.exception.InvalidDealException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DealFormMapperTest {

    private final DealFormMapper mapper = new DealFormMapper(new DealDeskProperties());

    private static DealForm form(String price, String adminFee, String bonusCash, String frequency) {
        return new DealForm(price, null, adminFee, null, null, null, null, null, bonusCash, frequency, null, null, null);
    }

    @Test
    void missingFormPricesAnEmptyDealWithDefaultFees() {
        DealInputs inputs = mapper.toInputs(null);

        assertThat(inputs.vehiclePrice()).isZero();
        assertThat(inputs.accessories()).isEmpty();
        assertThat(inputs.taxableFees()).isCloseTo(374.95, within(1e-9));
        assertThat(inputs.bonusCashOverride()).isNull();
        assertThat(inputs.frequency()).isEqualTo(PaymentFrequency.MONTHLY);
    }

    @Test
    void typedFeeReplacesDefaultEvenWhenBlank() {
        assertThat(mapper.toInputs(form("45000", "499", null, null)).adminFee()).isEqualTo(499.0);
        assertThat(mapper.toInputs(form("45000", "", null, null)).adminFee()).isZero();
    }

    @Test
    void configuredDefaultsApply() {
        DealDeskProperties properties = new DealDeskProperties();
        properties.getDefaultFees().setAdminFee(395.0);

        DealInputs inputs = new DealFormMapper(properties).toInputs(form("45000", null, null, null));

        assertThat(inputs.adminFee()).isEqualTo(395.0);
    }

    @Test
    void bonusCashOverrideOnlyWhenFilled() {
        assertThat(mapper.toInputs(form("45000", null, "", null)).bonusCashOverride()).isNull();
        assertThat(mapper.toInputs(form("45000", null, "0", null)).effectiveBonusCash(1000)).isZero();
        assertThat(mapper.toInputs(form("45000", null, "250", null)).effectiveBonusCash(1000)).isEqualTo(250.0);
    }

    @Test
    void parsesAccessoriesAndSkipsEmptyLines() {
        DealForm deal = new DealForm("45 000 $",
                Arrays.asList(new AccessoryLine("Tonneau", "1 250,00"), null, new AccessoryLine(null, "oops")),
                null, null, null, "12000", "9000", "2000", null, "biweekly", "47000", "-1500", "500");

        DealInputs inputs = mapper.toInputs(deal);

        assertThat(inputs.vehiclePrice()).isEqualTo(45000.0);
        assertThat(inputs.accessories()).hasSize(2);
        assertThat(inputs.accessoriesTotal()).isEqualTo(1250.0);
        assertThat(inputs.tradeInEquity()).isEqualTo(3000.0);
        assertThat(inputs.downPayment()).isEqualTo(2000.0);
        assertThat(inputs.frequency()).isEqualTo(PaymentFrequency.BIWEEKLY);
        assertThat(inputs.msrpBasis()).isEqualTo(47000.0);
        assertThat(inputs.carriedBalance()).isEqualTo(-1500.0);
        assertThat(inputs.dealerDiscount()).isEqualTo(500.0);
    }

    @Test
    void unknownFrequencyIsRejected() {
        assertThatThrownBy(() -> mapper.toInputs(form("45000", null, null, "daily")))
                .isInstanceOf(InvalidDealException.class)
                .hasMessageContaining("daily");
    }

    @Test
    void frequencyCodesAreCaseInsensitive() {
        assertThat(mapper.toInputs(form("1", null, null, "WEEKLY")).frequency()).isEqualTo(PaymentFrequency.WEEKLY);
        assertThat(List.of(PaymentFrequency.values())).extracting(PaymentFrequency::getCode)
                .containsExactly("monthly", "biweekly", "weekly");
    }
}
