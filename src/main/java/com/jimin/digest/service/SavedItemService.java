package com.jimin.digest.service;

import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Item;
import com.jimin.digest.entity.SavedItem;
import com.jimin.digest.exception.ItemNotFoundException;
import com.jimin.digest.repository.ItemRepository;
import com.jimin.digest.repository.SavedItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 저장(북마크) 아이템 Service
 *
 * 저장 자체는 등급 제한 없음, saved_items 스코프 검색은 premium 이상
 * save / unsave 모두 멱등
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SavedItemService {

    private final SavedItemRepository savedItemRepository;
    private final ItemRepository itemRepository;

    /**
     * @return 새로 저장했으면 true
     */
    public boolean save(String userId, String itemId) {
        if (!itemRepository.existsById(itemId)) {
            throw new ItemNotFoundException(itemId);
        }
        if (savedItemRepository.existsByUserIdAndItemId(userId, itemId)) {
            log.debug("이미 저장됨: user={}, item={}", userId, itemId);
            return false;
        }
        try {
            savedItemRepository.saveAndFlush(new SavedItem(userId, itemId));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("동시 저장 감지: user={}, item={}", userId, itemId);
            return false;
        }
    }

    @Transactional
    public boolean unsave(String userId, String itemId) {
        return savedItemRepository.deleteSaved(userId, itemId) > 0;
    }

    @Transactional(readOnly = true)
    public boolean isSaved(String userId, String itemId) {
        return savedItemRepository.existsByUserIdAndItemId(userId, itemId);
    }

    /**
     * 최근 저장순
     */
    @Transactional(readOnly = true)
    public List<ItemResponse> listSaved(String userId) {
        List<SavedItem> saved = savedItemRepository.findByUserIdOrderBySavedAtDesc(userId);
        Map<String, Item> items = itemRepository.findByIdIn(saved.stream().map(SavedItem::getItemId).toList())
                .stream()
                .collect(Collectors.toMap(Item::getId, Function.identity()));

        return saved.stream()
                .map(s -> items.get(s.getItemId()))
                .filter(Objects::nonNull)
                .map(ItemResponse::from)
                .toList();
    }
}
