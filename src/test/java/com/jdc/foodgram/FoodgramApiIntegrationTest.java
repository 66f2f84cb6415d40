package com.jdc.foodgram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.domain.repository.TagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class FoodgramApiIntegrationTest {

    private static final String IMAGE = "data:image/png;base64,iVBORw0KGgoAAAANSUhEUg==";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private TagRepository tagRepository;
    @Autowired
    private IngredientRepository ingredientRepository;

    private Tag breakfast;
    private Ingredient flour;
    private Ingredient milk;
    private Ingredient sugar;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        breakfast = tagRepository.save(Tag.builder().name("Breakfast " + suffix).slug("breakfast-" + suffix).build());
        flour = ingredientRepository.save(Ingredient.builder().name("flour " + suffix).measurementUnit("g").build());
        milk = ingredientRepository.save(Ingredient.builder().name("milk " + suffix).measurementUnit("ml").build());
        sugar = ingredientRepository.save(Ingredient.builder().name("sugar " + suffix).measurementUnit("g").build());
    }

    private String registerAndLogin(String username) throws Exception {
        String email = username + "@foodgram.io";
        Map<String, String> body = Map.of(
                "email", email,
                "username", username,
                "first_name", "Ivan",
                "last_name", "Petrov",
                "password", "S3cret-pass");
        mockMvc.perform(post("/api/users")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.username").value(username))
                .andExpect(jsonPath("$.first_name").value("Ivan"))
                .andExpect(jsonPath("$.password").doesNotExist());

        MvcResult login = mockMvc.perform(post("/api/auth/token/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", email, "password", "S3cret-pass"))))
                .andExpect(status().isOk())
                .andReturn();
        return "Token " + objectMapper.readTree(login.getResponse().getContentAsString()).get("auth_token").asText();
    }

    private static String uniqueName(String prefix) {
        return prefix + UUID.randomUUID().toString().substring(0, 8);
    }

    private String recipeJson(String name, List<Map<String, Object>> ingredients, String image) throws Exception {
        Map<String, Object> body = new HashMap<>();
        body.put("ingredients", ingredients);
        body.put("tags", List.of(breakfast.getId()));
        body.put("name", name);
        body.put("text", "Mix and bake.");
        body.put("cooking_time", 25);
        if (image != null) {
            body.put("image", image);
        }
        return objectMapper.writeValueAsString(body);
    }

    private long createRecipe(String token, String name, List<Map<String, Object>> ingredients) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(recipeJson(name, ingredients, IMAGE)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();
    }

    @Test
    @DisplayName("레시피 생성 후 조회하면 같은 내용이 돌아오고 플래그는 사용자 기준으로 계산된다")
    void createThenRead() throws Exception {
        String token = registerAndLogin(uniqueName("cook"));
        long id = createRecipe(token, "Pancakes", List.of(
                Map.of("id", flour.getId(), "amount", 200),
                Map.of("id", milk.getId(), "amount", 300)));

        mockMvc.perform(get("/api/recipes/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Pancakes"))
                .andExpect(jsonPath("$.cooking_time").value(25))
                .andExpect(jsonPath("$.tags[0].slug").value(breakfast.getSlug()))
                .andExpect(jsonPath("$.ingredients.length()").value(2))
                .andExpect(jsonPath("$.ingredients[0].measurement_unit").value("g"))
                .andExpect(jsonPath("$.ingredients[0].amount").value(200))
                .andExpect(jsonPath("$.image").value(startsWith("/media/recipes/images/")))
                .andExpect(jsonPath("$.is_favorited").value(false))
                .andExpect(jsonPath("$.is_in_shopping_cart").value(false));

        mockMvc.perform(post("/api/recipes/{id}/favorite", id).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Pancakes"));
        mockMvc.perform(post("/api/recipes/{id}/favorite", id).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/recipes/{id}", id).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(jsonPath("$.is_favorited").value(true));

        mockMvc.perform(delete("/api/recipes/{id}/favorite", id).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/recipes/{id}/favorite", id).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("수정하면 재료 목록이 통째로 교체되고 작성자가 아니면 403")
    void updateReplacesIngredients() throws Exception {
        String owner = registerAndLogin(uniqueName("owner"));
        String stranger = registerAndLogin(uniqueName("stranger"));
        long id = createRecipe(owner, "Porridge", List.of(
                Map.of("id", flour.getId(), "amount", 100),
                Map.of("id", milk.getId(), "amount", 200)));

        String update = recipeJson("Sweet porridge", List.of(Map.of("id", sugar.getId(), "amount", 15)), null);

        mockMvc.perform(patch("/api/recipes/{id}", id)
                        .header(HttpHeaders.AUTHORIZATION, stranger)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(update))
                .andExpect(status().isForbidden());

        mockMvc.perform(patch("/api/recipes/{id}", id)
                        .header(HttpHeaders.AUTHORIZATION, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(update))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Sweet porridge"))
                .andExpect(jsonPath("$.ingredients.length()").value(1))
                .andExpect(jsonPath("$.ingredients[0].id").value(sugar.getId()))
                .andExpect(jsonPath("$.ingredients[0].amount").value(15));

        mockMvc.perform(get("/api/recipes/{id}", id))
                .andExpect(jsonPath("$.ingredients.length()").value(1));
    }

    @Test
    @DisplayName("잘못된 레시피 요청은 필드 이름과 함께 400, 비로그인 작성은 401")
    void invalidRecipeRequests() throws Exception {
        String token = registerAndLogin(uniqueName("strict"));

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(recipeJson("Nope", List.of(Map.of("id", flour.getId(), "amount", 1)), IMAGE)))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(recipeJson("Dupes", List.of(
                                Map.of("id", flour.getId(), "amount", 1),
                                Map.of("id", flour.getId(), "amount", 2)), IMAGE)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("ingredients"));

        mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(recipeJson("Ghost", List.of(Map.of("id", 987654321L, "amount", 1)), IMAGE)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("ingredients"));

        mockMvc.perform(post("/api/recipes")
                        .header(HttpHeaders.AUTHORIZATION, token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(recipeJson("No image", List.of(Map.of("id", flour.getId(), "amount", 1)), null)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("image"));
    }

    @Test
    @DisplayName("짧은 링크는 레시피 페이지로 302 리다이렉트")
    void shortLinkRedirect() throws Exception {
        String token = registerAndLogin(uniqueName("linker"));
        long id = createRecipe(token, "Tea", List.of(Map.of("id", sugar.getId(), "amount", 5)));

        MvcResult linkResult = mockMvc.perform(get("/api/recipes/{id}/get-link", id))
                .andExpect(status().isOk())
                .andReturn();
        String link = objectMapper.readTree(linkResult.getResponse().getContentAsString()).get("short-link").asText();
        assertThat(link).matches(".*/s/[A-Za-z0-9]{6}/$");
        String path = link.substring(link.indexOf("/s/"));

        mockMvc.perform(get(path))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/recipes/" + id + "/"));

        mockMvc.perform(get("/s/zzzzzzzz/"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("장바구니 목록은 합산된 PDF 첨부파일로 내려간다")
    void downloadShoppingCart() throws Exception {
        String token = registerAndLogin(uniqueName("buyer"));
        long first = createRecipe(token, "Bread", List.of(Map.of("id", flour.getId(), "amount", 200)));
        long second = createRecipe(token, "Cake", List.of(
                Map.of("id", flour.getId(), "amount", 300),
                Map.of("id", sugar.getId(), "amount", 50)));

        mockMvc.perform(post("/api/recipes/{id}/shopping_cart", first).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isCreated());
        mockMvc.perform(post("/api/recipes/{id}/shopping_cart", second).header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isCreated());

        MvcResult pdf = mockMvc.perform(get("/api/recipes/download_shopping_cart").header(HttpHeaders.AUTHORIZATION, token))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("shopping_list.pdf")))
                .andReturn();
        assertThat(new String(pdf.getResponse().getContentAsByteArray(), 0, 5)).isEqualTo("%PDF-");

        mockMvc.perform(get("/api/recipes/download_shopping_cart"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("구독하면 작성자와 레시피 미리보기가 돌아오고 자기 자신은 구독할 수 없다")
    void subscriptions() throws Exception {
        String author = registerAndLogin(uniqueName("author"));
        String reader = registerAndLogin(uniqueName("reader"));
        createRecipe(author, "Soup", List.of(Map.of("id", milk.getId(), "amount", 500)));
        createRecipe(author, "Stew", List.of(Map.of("id", milk.getId(), "amount", 250)));

        JsonNode me = objectMapper.readTree(mockMvc.perform(get("/api/users/me").header(HttpHeaders.AUTHORIZATION, author))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString());
        long authorId = me.get("id").asLong();

        mockMvc.perform(post("/api/users/{id}/subscribe", authorId)
                        .param("recipes_limit", "1")
                        .header(HttpHeaders.AUTHORIZATION, reader))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.is_subscribed").value(true))
                .andExpect(jsonPath("$.recipes_count").value(2))
                .andExpect(jsonPath("$.recipes.length()").value(1))
                .andExpect(jsonPath("$.recipes[0].name").value("Stew"));

        mockMvc.perform(post("/api/users/{id}/subscribe", authorId).header(HttpHeaders.AUTHORIZATION, reader))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/users/{id}/subscribe", authorId).header(HttpHeaders.AUTHORIZATION, author))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/users/subscriptions").header(HttpHeaders.AUTHORIZATION, reader))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content.length()").value(1))
                .andExpect(jsonPath("$.content[0].recipes.length()").value(2));

        mockMvc.perform(delete("/api/users/{id}/subscribe", authorId).header(HttpHeaders.AUTHORIZATION, reader))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/users/{id}/subscribe", authorId).header(HttpHeaders.AUTHORIZATION, reader))
                .andExpect(status().isBadRequest());
    }
}
