package com.example.dealdesk.api;

import com.example.dealdesk.api.dto.DealDtos.AccessoryLine;
import com.example.dealdesk.api.dto.DealDtos.DealForm;
import com.example.dealdesk.config.DealDeskProperties;
import com.example.dealdesk.domain.AccessoryItem;
import com.example.dealdesk.domain.DealInputs;
import com.example.dealdesk.domain.PaymentFrequency;
import com.example.dealdesk.util.NumberParsing;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns the free-text deal form into numeric {@link DealInputs}.
 *
 * This is the only place user text is parsed: the calculators only ever see numbers.
 */
@Component
public class DealFormMapper {

    private final DealDeskProperties.DefaultFees defaultFees;

    public DealFormMapper(DealDeskProperties properties) {
        this.defaultFees = properties.getDefaultFees();
    }

    public DealInputs toInputs(DealForm form) {
        if (form == null) {
            form = new DealForm(null, null, null, null, null, null, null, null, null, null, null, null, null);
        }
        List<AccessoryItem> accessories = form.accessories() == null ? List.of()
                : form.accessories().stream()
                .filter(a -> a != null)
                .map(DealFormMapper::toAccessory)
                .toList();

        return DealInputs.builder()
                .vehiclePrice(NumberParsing.parseOrZero(form.vehiclePrice()))
                .accessories(accessories)
                .adminFee(feeOrDefault(form.adminFee(), defaultFees.getAdminFee()))
                .tireTax(feeOrDefault(form.tireTax(), defaultFees.getTireTax()))
                .rdprmFee(feeOrDefault(form.rdprmFee(), defaultFees.getRdprmFee()))
                .tradeInValue(NumberParsing.parseOrZero(form.tradeInValue()))
                .tradeInOwed(NumberParsing.parseOrZero(form.tradeInOwed()))
                .downPayment(NumberParsing.parseOrZero(form.downPayment()))
                .bonusCashOverride(NumberParsing.parseOrNull(form.bonusCash()))
                .frequency(PaymentFrequency.fromCode(form.frequency()))
                .pdsf(NumberParsing.parseOrZero(form.pdsf()))
                .carriedBalance(NumberParsing.parseOrZero(form.carriedBalance()))
                .dealerDiscount(NumberParsing.parseOrZero(form.dealerDiscount()))
                .build();
    }

    private static AccessoryItem toAccessory(AccessoryLine line) {
        return new AccessoryItem(line.description() == null ? "" : line.description(),
                NumberParsing.parseOrZero(line.price()));
    }

    private static double feeOrDefault(String text, double defaultFee) {
        return text == null ? defaultFee : NumberParsing.parseOrZero(text);
    }
}
