package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.TagDto;
import com.jdc.foodgram.domain.repository.TagRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.CatalogMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TagService {

    private final TagRepository tagRepository;

    public List<TagDto> getTags() {
        return tagRepository.findAllByOrderByNameAsc().stream()
                .map(CatalogMapper::toTagDto)
                .toList();
    }

    public TagDto getTag(Long id) {
        return tagRepository.findById(id)
                .map(CatalogMapper::toTagDto)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }
}
