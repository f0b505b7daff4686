package my.householdledger.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.householdledger.app.dto.CostBasisDto;
import my.householdledger.app.service.InvestmentCostBasisService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Investments", description = "Investment cost basis")
@RequestMapping("/api/investments")
public class InvestmentController {
	private final InvestmentCostBasisService costBasisService;

	public InvestmentController(InvestmentCostBasisService costBasisService) {
		this.costBasisService = costBasisService;
	}

	@Operation(summary = "Cumulative transfers into investment accounts")
	@GetMapping("/cost-basis")
	public List<CostBasisDto> costBasis(@RequestParam(value = "year", required = false) Integer year,
										@RequestParam(value = "month", required = false) Integer month) {
		return costBasisService.costBasis(year, month);
	}
}
