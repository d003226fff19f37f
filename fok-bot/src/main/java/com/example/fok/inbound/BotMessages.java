package com.example.fok.inbound;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatistics;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.service.exception.ErrorCode;
import java.util.ArrayList;
import java.util.List;

/**
 * User-facing texts of the bot.
 */
public final class BotMessages {

    public static final String WELCOME = "👋 Добро пожаловать в бот ФОК!\n\n"
            + "Для начала работы необходимо пройти регистрацию.\n"
            + "Как к вам обращаться? Введите ваше имя:";
    public static final String INVALID_NAME = "❌ Имя должно содержать от 2 до 64 символов и хотя бы одну букву. "
            + "Попробуйте еще раз:";
    public static final String ASK_PHONE = "Приятно познакомиться, %s!\n\n"
            + "📱 Теперь поделитесь номером телефона, нажав кнопку ниже, или введите его вручную:";
    public static final String INVALID_PHONE = "❌ Неверный формат номера телефона.\n"
            + "Введите номер в формате +7XXXXXXXXXX или нажмите кнопку «Поделиться контактом».";
    public static final String REGISTRATION_COMPLETED = "✅ Регистрация завершена! Спасибо, %s.";
    public static final String MAIN_MENU = "🏠 Главное меню\n\nВыберите действие:";
    public static final String HELP = "🆘 Помощь\n\n"
            + "Выберите ФОК в каталоге и подайте заявку на занятия.\n"
            + "/my — мои заявки\n/menu — главное меню\n/cancel — отменить текущее действие";
    public static final String ASK_SPORT = "🏅 Укажите вид спорта, которым хотите заниматься:";
    public static final String INVALID_SPORT = "❌ Название вида спорта должно содержать от 2 до 64 символов.";
    public static final String APPLICATION_SUBMITTED = "✅ Заявка успешно подана!\n\n"
            + "🏢 ФОК: %s\n🏅 Вид спорта: %s\n🆔 Номер заявки: #%s\n\n"
            + "Мы уведомим вас об изменении статуса.";
    public static final String APPLICATION_CANCELLED = "❌ Заявка #%s отменена.";
    public static final String APPLICATION_STATUS_SET = "✅ Заявка #%s: %s";
    public static final String ACTION_CANCELLED = "Действие отменено.";
    public static final String NO_APPLICATIONS = "📋 У вас пока нет заявок.";
    public static final String NO_APPLICATIONS_IN_STATUS = "📋 Нет заявок в статусе «%s».";
    public static final String COOLDOWN = "⚠️ Слишком много запросов. Пожалуйста, подождите немного.";
    public static final String UNKNOWN_COMMAND = "🤔 Не понимаю команду. Воспользуйтесь меню.";
    public static final String USAGE_USER_ID = "Укажите идентификатор пользователя: %s <id>";
    public static final String ADMIN_GRANTED = "✅ Пользователь %s назначен администратором.";
    public static final String ADMIN_REVOKED = "✅ Пользователь %s больше не администратор.";
    public static final String USER_BLOCKED = "🚫 Пользователь %s заблокирован.";
    public static final String USER_UNBLOCKED = "✅ Пользователь %s разблокирован.";
    public static final String SHARE_CONTACT_BUTTON = "📱 Поделиться контактом";

    private BotMessages() {
    }

    public static String errorText(ErrorCode code) {
        return switch (code) {
            case UNREGISTERED -> "❗ Сначала завершите регистрацию: отправьте /start";
            case BLOCKED -> "🚫 Ваш аккаунт заблокирован. Обратитесь к администратору.";
            case INVALID_TRANSITION -> "⚠️ Статус заявки уже изменен, действие недоступно.";
            case FORBIDDEN -> "⛔ У вас нет прав для этого действия.";
            case CONFLICT -> "🔄 Заявку одновременно изменил другой пользователь. Попробуйте еще раз.";
            case THROTTLED -> COOLDOWN;
            case STORAGE_UNAVAILABLE -> "😔 Сервис временно недоступен. Попробуйте позже.";
            case NOT_FOUND -> "🔍 Ничего не найдено.";
            case BAD_REQUEST -> "❌ Некорректный запрос.";
        };
    }

    public static BotReply mainMenu(boolean staff, String... leadingMessages) {
        List<String> messages = new ArrayList<>(List.of(leadingMessages));
        messages.add(MAIN_MENU);
        List<List<BotButton>> rows = new ArrayList<>();
        rows.add(List.of(BotButton.callback("📋 Мои заявки", "my_applications")));
        if (staff) {
            rows.add(List.of(BotButton.callback("🛠 Заявки на обработку", "admin_pending")));
            rows.add(List.of(BotButton.callback("📊 Статистика", "admin_stats")));
        }
        rows.add(List.of(BotButton.callback("🆘 Помощь", "help")));
        return new BotReply(messages, rows);
    }

    public static String statistics(ApplicationStatistics statistics) {
        StringBuilder text = new StringBuilder("📊 Статистика\n\n")
                .append("👥 Пользователей: ").append(statistics.users()).append('\n')
                .append("📋 Заявок: ").append(statistics.applications()).append("\n\n")
                .append("По статусам:");
        statistics.byStatus().forEach((status, count) ->
                text.append("\n• ").append(status.getDisplayName()).append(": ").append(count));
        return text.toString();
    }

    public static String describe(Application application) {
        return "#%s · %s · %s\n   %s".formatted(
                application.shortId(),
                application.getFacilityName(),
                application.getSport(),
                application.getStatus().getDisplayName());
    }

    public static String actionLabel(ApplicationStatus target) {
        return switch (target) {
            case ACCEPTED -> "✅ Принять";
            case TRANSFERRED -> "📤 Передать в ФОК";
            case COMPLETED -> "🎉 Выполнена";
            case CANCELLED -> "❌ Отменить";
            case PENDING -> target.getDisplayName();
        };
    }
}
