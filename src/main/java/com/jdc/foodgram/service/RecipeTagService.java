package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.TagRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeTagService {

    private final TagRepository tagRepository;

    /**
     * 요청한 태그 ID를 모두 찾아 요청 순서대로 돌려준다. 하나라도 없으면 tags 필드 오류.
     */
    public List<Tag> resolveTags(List<Long> tagIds) {
        Map<Long, Tag> found = tagRepository.findAllById(tagIds).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        List<Long> missing = tagIds.stream()
                .filter(id -> !found.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_TAGS, "존재하지 않는 태그입니다: " + missing, "tags");
        }

        return tagIds.stream().map(found::get).toList();
    }
}
