package com.example.dealdesk.api;

import com.example.dealdesk.domain.VehicleProgram;
import com.example.dealdesk.exception.ResourceNotFoundException;
import com.example.dealdesk.repository.ProgramRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/programs")
public class ProgramController {
    // Read-only repository serving the programs of the current period
    private final ProgramRepository repository;

    public ProgramController(ProgramRepository repository) {
        this.repository = repository;
    }

    // Programs for the selector, optionally narrowed by model year and brand
    @GetMapping
    public List<VehicleProgram> list(@RequestParam(required = false) Integer year,
                                     @RequestParam(required = false) String brand) {
        return repository.find(year, brand);
    }

    @GetMapping("/{id}")
    public VehicleProgram get(@PathVariable String id) {
        return repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Program not found: " + id));
    }
}
