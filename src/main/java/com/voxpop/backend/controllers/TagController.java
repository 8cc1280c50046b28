package com.voxpop.backend.controllers;

import com.voxpop.backend.dto.TagDto;
import com.voxpop.backend.dto.TagRequest;
import com.voxpop.backend.services.TagService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/supporters/tags")
@RequiredArgsConstructor
public class TagController {

    private final TagService tagService;

    /**
     * All tags with their live contact counts; {@code system} restricts to system or user tags.
     */
    @GetMapping
    public ResponseEntity<List<TagDto>> getTags(@RequestParam(required = false) Boolean system) {
        return ResponseEntity.ok(tagService.listTags(system));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TagDto> getTag(@PathVariable Long id) {
        return ResponseEntity.ok(tagService.getTag(id));
    }

    @PostMapping
    public ResponseEntity<TagDto> createTag(@Valid @RequestBody TagRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tagService.createTag(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<TagDto> updateTag(@PathVariable Long id, @Valid @RequestBody TagRequest request) {
        return ResponseEntity.ok(tagService.updateTag(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTag(@PathVariable Long id) {
        tagService.deleteTag(id);
        return ResponseEntity.noContent().build();
    }
}
